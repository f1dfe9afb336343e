package org.sfc.verification.cutpoint;

import org.junit.jupiter.api.Test;
import org.sfc.verification.petrinet.PetriNetHelper;
import org.sfc.verification.petrinet.models.PetriNet;
import org.sfc.verification.sfc.SfcHelper;
import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.sfc.models.Step;
import org.sfc.verification.sfc.models.Transition;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CutPointHelperTest {

    @Test
    void shouldMarkEveryPlaceOfTheFactorialLoop() {
        PetriNet net = PetriNetHelper.fromSfc(SfcHelper.loadFromClasspath("models/factorial.json"));

        assertEquals(List.of("Check", "End", "Increment", "Multiply", "Start"), CutPointHelper.findCutPoints(net));
    }

    @Test
    void shouldKeepStraightLineStepsOutOfCutPoints() {
        PetriNet net = PetriNetHelper.fromSfc(SfcHelper.loadFromClasspath("models/branch.json"));

        assertEquals(List.of("Done", "S0", "Split"), CutPointHelper.findCutPoints(net));
    }

    @Test
    void shouldFindInitialBranchAndSinkInChain() {
        Sfc sfc = Sfc.builder()
                .steps(List.of(new Step("A", ""), new Step("B", ""), new Step("C", ""), new Step("D", ""), new Step("E", "")))
                .transitions(List.of(
                        new Transition("A", "B", "x > 0"),
                        new Transition("B", "C", "y > 0"),
                        new Transition("B", "D", "y <= 0"),
                        new Transition("C", "E", ""),
                        new Transition("D", "E", "")))
                .initialStep("A")
                .build();

        List<String> cutPoints = CutPointHelper.findCutPoints(PetriNetHelper.fromSfc(sfc));

        assertEquals(List.of("A", "B", "E"), cutPoints);
    }

    @Test
    void shouldDetectPlacesOnCycles() {
        PetriNet net = PetriNetHelper.fromSfc(SfcHelper.loadFromClasspath("models/factorial.json"));
        Map<String, Set<String>> outgoing = PetriNetHelper.outgoingTransitions(net);
        Map<String, Set<String>> targets = PetriNetHelper.transitionTargets(net);

        assertTrue(CutPointHelper.isOnCycle("Multiply", outgoing, targets));
        assertFalse(CutPointHelper.isOnCycle("Start", outgoing, targets));
        assertFalse(CutPointHelper.isOnCycle("End", outgoing, targets));
    }

    @Test
    void shouldBeDeterministic() {
        PetriNet net = PetriNetHelper.fromSfc(SfcHelper.loadFromClasspath("models/factorial.json"));

        assertEquals(CutPointHelper.findCutPoints(net), CutPointHelper.findCutPoints(net));
    }
}
