package org.sfc.verification.sfc.models;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable Sequential Function Chart: ordered steps, guarded transitions, the variables the
 * step functions and guards refer to, and the initial step.
 */
@Builder
public record Sfc(
        List<Step> steps,
        List<Transition> transitions,
        List<String> variables,
        String initialStep
) {
    public Sfc {
        steps = steps == null ? List.of() : List.copyOf(steps);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public List<String> stepNames() {
        return steps.stream().map(Step::name).toList();
    }

    /**
     * @return step name to entry assignment text, in declaration order; the first of duplicate names wins
     */
    public Map<String, String> stepFunctions() {
        Map<String, String> functions = new LinkedHashMap<>();
        for (Step step : steps) {
            functions.putIfAbsent(step.name(), step.function());
        }
        return functions;
    }
}
