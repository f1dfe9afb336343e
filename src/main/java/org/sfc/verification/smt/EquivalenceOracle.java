package org.sfc.verification.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.sfc.verification.config.DataComparison;
import org.sfc.verification.config.VerifierConfig;
import org.sfc.verification.expression.PrefixParser;
import org.sfc.verification.expression.PrefixSyntaxException;
import org.sfc.verification.expression.models.SExpr;
import org.sfc.verification.sfc.models.Guard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Decides whether two path conditions, or two data transformations, mean the same thing.
 * <p>
 * Every query runs in its own Z3 {@link Context}, so one oracle can be shared between threads.
 * Any failure to build or decide a query (unparsable text, mixed sorts, solver timeout or
 * {@link Status#UNKNOWN}) counts as "not equivalent".
 */
public class EquivalenceOracle {
    private static final Logger log = LoggerFactory.getLogger(EquivalenceOracle.class);

    private static final String TRUE = "true";

    private final DataComparison dataComparison;
    private final int timeoutMillis;

    public EquivalenceOracle() {
        this(VerifierConfig.defaults());
    }

    public EquivalenceOracle(VerifierConfig config) {
        this(config.dataComparison == null ? DataComparison.SYNTACTIC : config.dataComparison,
                config.solverTimeoutMillis);
    }

    public EquivalenceOracle(DataComparison dataComparison, int timeoutMillis) {
        this.dataComparison = dataComparison;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Checks that two path conditions hold for exactly the same valuations, by asking the solver
     * for a valuation on which they differ.
     *
     * @param cond1 prefix condition
     * @param cond2 prefix condition
     * @return true only when the solver proves that no such valuation exists
     */
    public boolean areConditionsEquivalent(String cond1, String cond2) {
        if (isTrivial(cond1) && isTrivial(cond2)) {
            return true;
        }
        try (Context ctx = new Context()) {
            Z3TermBuilder builder = new Z3TermBuilder(ctx);
            SExpr tree1 = PrefixParser.parse(cond1);
            SExpr tree2 = PrefixParser.parse(cond2);
            builder.scanCondition(tree1);
            builder.scanCondition(tree2);
            BoolExpr e1 = builder.toBool(tree1);
            BoolExpr e2 = builder.toBool(tree2);
            return isUnsat(ctx, ctx.mkXor(e1, e2), cond1, cond2);
        } catch (PrefixSyntaxException | Z3TermException | Z3Exception e) {
            log.debug("Conditions '{}' and '{}' not comparable: {}", cond1, cond2, e.getMessage());
            return false;
        }
    }

    /**
     * Checks that two data transformations agree on every given variable.
     * <p>
     * In {@link DataComparison#SYNTACTIC} mode both sides must hold the same fact text for each
     * variable, or both lack a fact. In {@link DataComparison#SEMANTIC} mode a missing fact stands for
     * the unchanged entry value and the two values must be provably equal.
     *
     * @param subst1    prefix data transformation
     * @param subst2    prefix data transformation
     * @param variables the variables to compare
     * @return true when the transformations agree on all {@code variables}
     */
    public boolean areDataTransformationsEquivalent(String subst1, String subst2, Collection<String> variables) {
        if (Objects.equals(subst1, subst2)) {
            return true;
        }
        Map<String, String> facts1;
        Map<String, String> facts2;
        try {
            facts1 = parseAssignments(subst1);
            facts2 = parseAssignments(subst2);
        } catch (PrefixSyntaxException e) {
            log.debug("Data transformations '{}' and '{}' not comparable: {}", subst1, subst2, e.getMessage());
            return false;
        }

        for (String variable : variables) {
            if (dataComparison == DataComparison.SEMANTIC) {
                String value1 = facts1.getOrDefault(variable, variable);
                String value2 = facts2.getOrDefault(variable, variable);
                if (!value1.equals(value2) && !areValuesEqual(value1, value2)) {
                    return false;
                }
            } else if (!Objects.equals(facts1.get(variable), facts2.get(variable))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reads the facts of a data transformation. Each {@code (= v expr)} conjunct maps {@code v} to
     * the text of {@code expr}; a later fact for the same variable replaces an earlier one.
     * Conjuncts of any other shape are ignored.
     *
     * @param subst prefix data transformation, {@code true} for none
     * @return variable to value text, in fact order
     * @throws PrefixSyntaxException if {@code subst} is not a balanced prefix term
     */
    public static Map<String, String> parseAssignments(String subst) {
        Map<String, String> facts = new LinkedHashMap<>();
        if (subst == null || subst.isBlank() || subst.trim().equals(TRUE)) {
            return facts;
        }
        SExpr expr = PrefixParser.parse(subst);
        List<SExpr> conjuncts = expr instanceof SExpr.ListExpr list && "and".equals(list.head())
                ? list.args()
                : List.of(expr);
        for (SExpr conjunct : conjuncts) {
            if (conjunct instanceof SExpr.ListExpr fact && "=".equals(fact.head()) && fact.args().size() >= 2
                    && fact.args().get(0) instanceof SExpr.Atom variable) {
                String value = fact.args().subList(1, fact.args().size()).stream()
                        .map(SExpr::render)
                        .collect(Collectors.joining(" "));
                facts.put(variable.token(), value);
            } else {
                log.debug("Ignoring conjunct '{}' of data transformation", conjunct.render());
            }
        }
        return facts;
    }

    private boolean areValuesEqual(String value1, String value2) {
        try (Context ctx = new Context()) {
            Z3TermBuilder builder = new Z3TermBuilder(ctx);
            SExpr left = PrefixParser.parse(value1);
            SExpr right = PrefixParser.parse(value2);
            builder.scanTerm(left);
            builder.scanTerm(right);
            BoolExpr equal = builder.isBoolean(left) || builder.isBoolean(right)
                    ? ctx.mkEq(builder.toBool(left), builder.toBool(right))
                    : ctx.mkEq(builder.toInt(left), builder.toInt(right));
            return isUnsat(ctx, ctx.mkNot(equal), value1, value2);
        } catch (PrefixSyntaxException | Z3TermException | Z3Exception e) {
            log.debug("Values '{}' and '{}' not comparable: {}", value1, value2, e.getMessage());
            return false;
        }
    }

    private boolean isUnsat(Context ctx, BoolExpr difference, String left, String right) {
        Solver solver = ctx.mkSolver();
        if (timeoutMillis > 0) {
            Params params = ctx.mkParams();
            params.add("timeout", timeoutMillis);
            solver.setParameters(params);
        }
        solver.add(difference);
        Status status = solver.check();
        if (status == Status.UNKNOWN) {
            log.warn("Solver gave up comparing '{}' and '{}': {}", left, right, solver.getReasonUnknown());
        }
        return status == Status.UNSATISFIABLE;
    }

    private static boolean isTrivial(String cond) {
        if (cond == null) {
            return false;
        }
        String trimmed = cond.trim();
        return trimmed.equals(TRUE) || trimmed.equals(Guard.INIT_MARKER);
    }
}
