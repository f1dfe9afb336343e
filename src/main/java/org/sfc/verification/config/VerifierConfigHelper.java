package org.sfc.verification.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class VerifierConfigHelper {
    private static final Logger log = LoggerFactory.getLogger(VerifierConfigHelper.class);

    private static final Set<String> REPORT_FORMATS = Set.of("json", "html", "dot");

    /**
     * Loads the verifier configuration, or the defaults when no path is given.
     *
     * @param configFilePath path to a JSON config file, may be null
     * @return the configuration
     * @throws IOException           if the file cannot be read or parsed
     * @throws IllegalStateException if the file holds invalid values
     */
    public static VerifierConfig loadConfig(String configFilePath) throws IOException {
        if (configFilePath == null) {
            return VerifierConfig.defaults();
        }
        ObjectMapper mapper = new ObjectMapper();
        VerifierConfig config = mapper.readValue(new File(configFilePath), VerifierConfig.class);
        validateConfig(config);
        log.debug("Loaded configuration from {}", configFilePath);
        return config;
    }

    public static void validateConfig(VerifierConfig config) {
        if (config.dataComparison == null) {
            config.dataComparison = DataComparison.SYNTACTIC;
        }
        if (config.solverTimeoutMillis < 0) {
            throw new IllegalStateException("solverTimeoutMillis must not be negative, was " + config.solverTimeoutMillis);
        }
        if (config.reportFormats == null) {
            config.reportFormats = List.of();
        }
        for (String format : config.reportFormats) {
            if (format == null || !REPORT_FORMATS.contains(format.toLowerCase(Locale.ROOT))) {
                throw new IllegalStateException("Unknown report format '" + format + "', expected one of " + REPORT_FORMATS);
            }
        }
    }
}
