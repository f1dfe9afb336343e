package org.sfc.verification.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerifierConfigHelperTest {
    private static final String SEMANTIC_CONFIG = "src/test/resources/config/semantic_config.json";
    private static final String NEGATIVE_TIMEOUT_CONFIG = "src/test/resources/config/negative_timeout_config.json";

    @Test
    void shouldUseDefaultsWithoutConfigFile() throws IOException {
        VerifierConfig config = VerifierConfigHelper.loadConfig(null);

        assertEquals(DataComparison.SYNTACTIC, config.dataComparison);
        assertEquals(0, config.solverTimeoutMillis);
        assertFalse(config.parallelMatching);
        assertFalse(config.strictModelValidation);
        assertEquals(List.of("json"), config.reportFormats);
    }

    @Test
    void shouldLoadConfigFile() throws IOException {
        VerifierConfig config = VerifierConfigHelper.loadConfig(SEMANTIC_CONFIG);

        assertEquals(DataComparison.SEMANTIC, config.dataComparison);
        assertEquals(5000, config.solverTimeoutMillis);
        assertTrue(config.parallelMatching);
        assertTrue(config.strictModelValidation);
        assertEquals(List.of("json", "html", "dot"), config.reportFormats);
    }

    @Test
    void shouldRejectNegativeTimeout() {
        assertThrows(IllegalStateException.class, () -> VerifierConfigHelper.loadConfig(NEGATIVE_TIMEOUT_CONFIG));
    }

    @Test
    void shouldRejectUnknownReportFormat() {
        VerifierConfig config = VerifierConfig.defaults();
        config.reportFormats = List.of("pdf");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> VerifierConfigHelper.validateConfig(config));
        assertTrue(e.getMessage().contains("pdf"));
    }

    @Test
    void shouldDefaultMissingDataComparison() {
        VerifierConfig config = VerifierConfig.defaults();
        config.dataComparison = null;

        VerifierConfigHelper.validateConfig(config);

        assertEquals(DataComparison.SYNTACTIC, config.dataComparison);
    }

    @Test
    void shouldFailOnMissingFile() {
        assertThrows(IOException.class, () -> VerifierConfigHelper.loadConfig("src/test/resources/config/missing.json"));
    }
}
