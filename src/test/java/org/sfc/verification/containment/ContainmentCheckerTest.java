package org.sfc.verification.containment;

import org.junit.jupiter.api.Test;
import org.sfc.verification.config.VerifierConfig;
import org.sfc.verification.containment.models.ContainmentResult;
import org.sfc.verification.containment.models.PathMatch;
import org.sfc.verification.path.models.CutPointPath;
import org.sfc.verification.sfc.SfcHelper;
import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.sfc.models.Step;
import org.sfc.verification.sfc.models.Transition;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContainmentCheckerTest {
    private static final String FACTORIAL = "models/factorial.json";
    private static final String FACTORIAL_CLEANUP = "models/factorial_cleanup.json";
    private static final String FACTORIAL_WRONG_GUARD = "models/factorial_wrong_guard.json";
    private static final String BRANCH = "models/branch.json";

    private final ContainmentChecker checker = new ContainmentChecker();

    @Test
    void shouldContainModelInItself() {
        Sfc factorial = SfcHelper.loadFromClasspath(FACTORIAL);

        ContainmentResult result = checker.check(factorial, factorial);

        assertTrue(result.contained());
        assertTrue(result.unmatched1().isEmpty());
        assertEquals(result.paths1().size(), result.matches1().size());
        for (PathMatch match : result.matches1()) {
            assertEquals(match.path1().cond(), match.path2().cond());
        }
    }

    @Test
    void shouldContainBranchingModelInItself() {
        Sfc branch = SfcHelper.loadFromClasspath(BRANCH);

        assertTrue(checker.check(branch, branch).contained());
    }

    @Test
    void shouldContainModelWithBooleanEqualityGuardInItself() {
        Sfc flags = Sfc.builder()
                .steps(List.of(new Step("Wait", ""), new Step("Go", "count := count + 1"), new Step("Stop", "")))
                .transitions(List.of(
                        new Transition("Wait", "Go", "ready == done && ready"),
                        new Transition("Wait", "Stop", "!ready")))
                .variables(List.of("ready", "done", "count"))
                .initialStep("Wait")
                .build();

        ContainmentResult result = checker.check(flags, flags);

        assertEquals("(and (= ready done) ready)", result.paths1().get(0).cond());
        assertTrue(result.contained());
        assertEquals(2, result.matches1().size());
    }

    @Test
    void shouldContainFactorialInVariantWithExtraCleanupStep() {
        Sfc factorial = SfcHelper.loadFromClasspath(FACTORIAL);
        Sfc cleanup = SfcHelper.loadFromClasspath(FACTORIAL_CLEANUP);

        ContainmentResult result = checker.check(factorial, cleanup);

        assertTrue(result.contained());
        assertEquals(List.of("fact", "i", "init", "n"), result.commonVariables());
        assertEquals(List.of("Check", "End", "Increment", "Multiply", "Start"), result.cutpoints2());
        PathMatch exit = result.matches1().get(1);
        assertEquals("End", exit.path1().to());
        assertEquals(List.of("t_4", "t_5"), exit.path2().transitions());
    }

    @Test
    void shouldReportTheOnlyPathWithDifferentGuard() {
        Sfc wrongGuard = SfcHelper.loadFromClasspath(FACTORIAL_WRONG_GUARD);
        Sfc factorial = SfcHelper.loadFromClasspath(FACTORIAL);

        ContainmentResult result = checker.check(wrongGuard, factorial);

        assertFalse(result.contained());
        assertEquals(1, result.unmatched1().size());
        CutPointPath unmatched = result.unmatched1().get(0);
        assertEquals("Check", unmatched.from());
        assertEquals("Multiply", unmatched.to());
        assertEquals("(< i n)", unmatched.cond());
        assertEquals(result.paths1().size() - 1, result.matches1().size());
    }

    @Test
    void shouldNotContainFactorialInVariantWithStricterLoopGuard() {
        Sfc wrongGuard = SfcHelper.loadFromClasspath(FACTORIAL_WRONG_GUARD);
        Sfc factorial = SfcHelper.loadFromClasspath(FACTORIAL);

        ContainmentResult result = checker.check(factorial, wrongGuard);

        assertFalse(result.contained());
        assertEquals(1, result.unmatched1().size());
        assertEquals("(<= i n)", result.unmatched1().get(0).cond());
    }

    @Test
    void shouldMatchFirstEquivalentPathInEnumerationOrder() {
        Sfc factorial = SfcHelper.loadFromClasspath(FACTORIAL);

        ContainmentResult result = checker.check(factorial, factorial);

        // Start -> Check is unguarded with no facts, like Increment -> Check which comes first
        PathMatch start = result.matches1().get(4);
        assertEquals("Start", start.path1().from());
        assertEquals("Increment", start.path2().from());
    }

    @Test
    void shouldGiveSameResultWhenMatchingInParallel() {
        VerifierConfig config = VerifierConfig.defaults();
        config.parallelMatching = true;
        Sfc wrongGuard = SfcHelper.loadFromClasspath(FACTORIAL_WRONG_GUARD);
        Sfc factorial = SfcHelper.loadFromClasspath(FACTORIAL);

        ContainmentResult sequential = checker.check(wrongGuard, factorial);
        ContainmentResult parallel = new ContainmentChecker(config).check(wrongGuard, factorial);

        assertEquals(sequential, parallel);
    }

    @Test
    void shouldBeIdempotent() {
        Sfc factorial = SfcHelper.loadFromClasspath(FACTORIAL);
        Sfc cleanup = SfcHelper.loadFromClasspath(FACTORIAL_CLEANUP);

        assertEquals(checker.check(factorial, cleanup), checker.check(factorial, cleanup));
    }
}
