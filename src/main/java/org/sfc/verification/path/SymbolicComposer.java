package org.sfc.verification.path;

import org.sfc.verification.expression.ExpressionTranslator;
import org.sfc.verification.path.models.PathSymbolics;
import org.sfc.verification.petrinet.models.NetTransition;
import org.sfc.verification.petrinet.models.PetriNet;
import org.sfc.verification.sfc.models.Guard;
import org.sfc.verification.sfc.models.Sfc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the path condition and data transformation of a transition sequence.
 * <p>
 * A running substitution maps every variable to its current value expressed over the values
 * the variables had when the path was entered. Each entry assignment {@code lhs := rhs} of a
 * step marked along the path is rendered with the current substitution applied to {@code rhs},
 * so the resulting facts do not depend on the order or naming of the intermediate steps.
 */
public class SymbolicComposer {
    private static final Logger log = LoggerFactory.getLogger(SymbolicComposer.class);

    private static final String ASSIGN = ":=";
    private static final Pattern IDENTIFIER = Pattern.compile("\\b[A-Za-z_][A-Za-z0-9_]*\\b");

    private final Sfc sfc;
    private final PetriNet net;
    private final Map<String, Set<String>> targets;
    private final Map<String, String> stepFunctions;

    public SymbolicComposer(Sfc sfc, PetriNet net, Map<String, Set<String>> targets) {
        this.sfc = sfc;
        this.net = net;
        this.targets = targets;
        this.stepFunctions = sfc.stepFunctions();
    }

    /**
     * @param transitionIds    the path, in firing order
     * @param allowedVariables variables whose facts are kept in the data transformation; null keeps all
     * @return the path condition and data transformation
     */
    public PathSymbolics compose(List<String> transitionIds, Set<String> allowedVariables) {
        Map<String, String> substitution = new LinkedHashMap<>();
        for (String variable : sfc.variables()) {
            substitution.put(variable, variable);
        }
        List<String> guards = new ArrayList<>();
        List<Fact> facts = new ArrayList<>();

        for (String transitionId : transitionIds) {
            NetTransition transition = net.transition(transitionId);
            if (transition == null) {
                continue;
            }
            if (transition.guard() instanceof Guard.Expression expression) {
                guards.add(ExpressionTranslator.translate(expression.text()));
            }
            for (String target : targets.getOrDefault(transitionId, Set.of())) {
                String function = stepFunctions.get(target);
                if (function != null && !function.isBlank()) {
                    applyAssignments(function, substitution, facts);
                }
            }
        }

        List<String> kept = new ArrayList<>();
        for (Fact fact : facts) {
            if (allowedVariables == null || allowedVariables.contains(fact.variable())) {
                kept.add(fact.render());
            }
        }

        PathSymbolics symbolics = new PathSymbolics(conjunction(guards), conjunction(kept));
        log.debug("Path {}: cond={} subst={}", transitionIds, symbolics.cond(), symbolics.subst());
        return symbolics;
    }

    private static void applyAssignments(String function, Map<String, String> substitution, List<Fact> facts) {
        for (String statement : function.split(";")) {
            int assign = statement.indexOf(ASSIGN);
            if (assign < 0) {
                continue;
            }
            String lhs = statement.substring(0, assign).trim();
            String rhs = statement.substring(assign + ASSIGN.length()).trim();
            if (lhs.isEmpty()) {
                continue;
            }

            String value = ExpressionTranslator.tryTranslate(rhs, substitution)
                    .orElseGet(() -> substituteWholeWords(rhs, substitution));
            substitution.put(lhs, value);
            facts.add(new Fact(lhs, value));
        }
    }

    /**
     * Fallback for right-hand sides the translator cannot read: replaces whole identifiers by their
     * current values in one pass over the raw text.
     */
    static String substituteWholeWords(String text, Map<String, String> substitution) {
        Matcher matcher = IDENTIFIER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = substitution.getOrDefault(matcher.group(), matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        log.warn("Right-hand side '{}' is not translatable, kept as text '{}'", text, out);
        return out.toString();
    }

    private record Fact(String variable, String value) {
        String render() {
            return "(= " + variable + " " + value + ")";
        }
    }

    static String conjunction(List<String> terms) {
        if (terms.isEmpty()) {
            return "true";
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return "(and " + String.join(" ", terms) + ")";
    }
}
