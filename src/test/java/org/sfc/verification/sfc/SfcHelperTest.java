package org.sfc.verification.sfc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sfc.verification.sfc.models.Guard;
import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.sfc.models.Transition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SfcHelperTest {
    private static final String FACTORIAL_RESOURCE = "models/factorial.json";
    private static final String FACTORIAL_FILE = "src/test/resources/models/factorial.json";
    private static final String BRANCH_FILE = "src/test/resources/models/branch.json";
    private static final String UNDECLARED_TARGET_FILE = "src/test/resources/models/undeclared_target.json";
    private static final String INVALID_FILE = "src/test/resources/models/invalid_missing_steps.json";

    @Test
    void shouldLoadFactorialFromClasspath() {
        Sfc sfc = SfcHelper.loadFromClasspath(FACTORIAL_RESOURCE);

        assertEquals(List.of("Start", "Check", "Multiply", "Increment", "End"), sfc.stepNames());
        assertEquals(5, sfc.transitions().size());
        assertEquals(List.of("i", "fact", "n", "init"), sfc.variables());
        assertEquals("Start", sfc.initialStep());
        assertEquals("i := 1; fact := 1", sfc.stepFunctions().get("Start"));
    }

    @Test
    void shouldClassifyGuardsOnLoad() {
        Sfc sfc = SfcHelper.loadFromFile(FACTORIAL_FILE);

        assertInstanceOf(Guard.Always.class, sfc.transitions().get(0).guard());
        assertEquals("init", sfc.transitions().get(0).guard().text());
        assertInstanceOf(Guard.Expression.class, sfc.transitions().get(1).guard());
        assertEquals("i <= n", sfc.transitions().get(1).guard().text());
        assertInstanceOf(Guard.Always.class, sfc.transitions().get(2).guard());
    }

    @Test
    void shouldAcceptSingleStringAndArrayStepReferences() {
        Sfc sfc = SfcHelper.loadFromFile(BRANCH_FILE);

        Transition single = sfc.transitions().get(0);
        Transition array = sfc.transitions().get(4);
        assertEquals(List.of("S0"), single.src());
        assertEquals(List.of("Right"), array.src());
        assertEquals(List.of("Done"), array.tgt());
        assertInstanceOf(Guard.Always.class, array.guard());
    }

    @Test
    void shouldValidateWellFormedFile() {
        assertDoesNotThrow(() -> SfcHelper.validate(FACTORIAL_FILE));
    }

    @Test
    void shouldRejectFileViolatingSchema() {
        SfcModelException e = assertThrows(SfcModelException.class, () -> SfcHelper.validate(INVALID_FILE));

        assertFalse(e.getProblems().isEmpty());
        assertTrue(e.getMessage().contains("invalid"));
    }

    @Test
    void shouldFailOnMissingFile() {
        SfcModelException e = assertThrows(SfcModelException.class,
                () -> SfcHelper.loadFromFile("src/test/resources/models/does_not_exist.json"));

        assertTrue(e.getMessage().startsWith("Error parsing SFC file"));
        assertNotNull(e.getCause());
    }

    @Test
    void shouldFailOnMissingClasspathResource() {
        assertThrows(IllegalArgumentException.class, () -> SfcHelper.loadFromClasspath("models/nope.json"));
    }

    @Test
    void shouldTolerateUndeclaredStepsWhenLenient() {
        Sfc sfc = SfcHelper.loadFromFile(UNDECLARED_TARGET_FILE);

        assertEquals(List.of("A"), sfc.stepNames());
        assertEquals(List.of("Ghost"), sfc.transitions().get(0).tgt());
    }

    @Test
    void shouldRejectUndeclaredStepsWhenStrict() {
        SfcModelException e = assertThrows(SfcModelException.class,
                () -> SfcHelper.loadFromFile(UNDECLARED_TARGET_FILE, true));

        assertEquals(List.of("Transition t_0 references undeclared target step 'Ghost'"), e.getProblems());
    }

    @Test
    void shouldSaveModelThatLoadsBackEqual(@TempDir Path tempDir) throws IOException {
        Sfc sfc = SfcHelper.loadFromFile(BRANCH_FILE);
        String target = tempDir.resolve("branch_copy.json").toString();

        SfcHelper.save(sfc, target);
        SfcHelper.validate(target);

        assertEquals(sfc, SfcHelper.loadFromFile(target));
    }
}
