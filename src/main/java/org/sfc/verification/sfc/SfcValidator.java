package org.sfc.verification.sfc;

import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.sfc.models.Step;
import org.sfc.verification.sfc.models.Transition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a loaded SFC. The containment engine itself tolerates every problem
 * reported here (undeclared steps simply become dead-end places), so callers decide whether
 * a problem is fatal.
 */
public class SfcValidator {

    /**
     * Lists structural problems of the model.
     *
     * @param sfc the model to inspect
     * @return human-readable problems, empty when the model is well formed
     */
    public static List<String> findProblems(Sfc sfc) {
        List<String> problems = new ArrayList<>();
        Set<String> declared = new HashSet<>();

        for (Step step : sfc.steps()) {
            if (step.name() == null || step.name().isBlank()) {
                problems.add("Step without a name");
            } else if (!declared.add(step.name())) {
                problems.add("Duplicate step '" + step.name() + "'");
            }
        }

        if (sfc.initialStep() == null || sfc.initialStep().isBlank()) {
            problems.add("Initial step is not set");
        } else if (!declared.contains(sfc.initialStep())) {
            problems.add("Initial step '" + sfc.initialStep() + "' is not a declared step");
        }

        for (int i = 0; i < sfc.transitions().size(); i++) {
            Transition transition = sfc.transitions().get(i);
            if (transition.src().isEmpty()) {
                problems.add("Transition t_" + i + " has no source step");
            }
            if (transition.tgt().isEmpty()) {
                problems.add("Transition t_" + i + " has no target step");
            }
            for (String src : transition.src()) {
                if (!declared.contains(src)) {
                    problems.add("Transition t_" + i + " references undeclared source step '" + src + "'");
                }
            }
            for (String tgt : transition.tgt()) {
                if (!declared.contains(tgt)) {
                    problems.add("Transition t_" + i + " references undeclared target step '" + tgt + "'");
                }
            }
        }
        return problems;
    }

    public static boolean isValid(Sfc sfc) {
        return findProblems(sfc).isEmpty();
    }
}
