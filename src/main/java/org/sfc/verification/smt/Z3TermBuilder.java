package org.sfc.verification.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntSort;
import org.sfc.verification.expression.models.SExpr;
import org.sfc.verification.sfc.models.Guard;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds Z3 terms from parsed prefix expressions.
 * <p>
 * Identifiers become unbounded integer constants, except where they stand in a boolean
 * position (operand of a connective, or a whole condition), where they become boolean constants.
 * Boolean positions are collected by {@link #scanCondition(SExpr)} / {@link #scanTerm(SExpr)} over
 * every term of a query before any term is built, so the sort of an {@code =} operand does not
 * depend on operand order. Using one name with both sorts in the same query is rejected, and so
 * is any atom that is neither a decimal integer nor an identifier. One builder serves one
 * {@link Context}; neither is thread-safe.
 */
class Z3TermBuilder {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> BOOLEAN_HEADS = Set.of("and", "or", "not", "=", "<", "<=", ">", ">=");

    private final Context ctx;
    private final Map<String, BoolExpr> boolSymbols = new HashMap<>();
    private final Map<String, IntExpr> intSymbols = new HashMap<>();
    private final Set<String> booleanNames = new HashSet<>();

    Z3TermBuilder(Context ctx) {
        this.ctx = ctx;
    }

    /**
     * Records the identifiers of a whole condition that stand in a boolean position.
     */
    void scanCondition(SExpr condition) {
        scan(condition, true);
    }

    /**
     * Records the identifiers of a value term that stand in a boolean position.
     */
    void scanTerm(SExpr term) {
        scan(term, false);
    }

    private void scan(SExpr expr, boolean booleanPosition) {
        if (expr instanceof SExpr.Atom atom) {
            if (booleanPosition && IDENTIFIER.matcher(atom.token()).matches()) {
                booleanNames.add(atom.token());
            }
            return;
        }
        SExpr.ListExpr list = (SExpr.ListExpr) expr;
        String head = list.head();
        boolean connective = "and".equals(head) || "or".equals(head) || "not".equals(head);
        for (SExpr arg : list.args()) {
            scan(arg, connective);
        }
    }

    BoolExpr toBool(SExpr expr) {
        if (expr instanceof SExpr.Atom atom) {
            String token = atom.token();
            if (token.equals("true") || token.equals(Guard.INIT_MARKER)) {
                return ctx.mkTrue();
            }
            if (token.equals("false")) {
                return ctx.mkFalse();
            }
            if (INTEGER.matcher(token).matches()) {
                throw new Z3TermException("integer literal " + token + " used as a condition");
            }
            return boolSymbol(requireIdentifier(token));
        }

        SExpr.ListExpr list = (SExpr.ListExpr) expr;
        String head = requireHead(list);
        List<SExpr> args = list.args();
        return switch (head) {
            case "and" -> ctx.mkAnd(boolArgs(args));
            case "or" -> ctx.mkOr(boolArgs(args));
            case "not" -> ctx.mkNot(toBool(single(list)));
            case "=" -> equality(binaryArgs(list));
            case "<" -> ctx.mkLt(toInt(binaryArgs(list).get(0)), toInt(binaryArgs(list).get(1)));
            case "<=" -> ctx.mkLe(toInt(binaryArgs(list).get(0)), toInt(binaryArgs(list).get(1)));
            case ">" -> ctx.mkGt(toInt(binaryArgs(list).get(0)), toInt(binaryArgs(list).get(1)));
            case ">=" -> ctx.mkGe(toInt(binaryArgs(list).get(0)), toInt(binaryArgs(list).get(1)));
            default -> throw new Z3TermException("'" + head + "' does not yield a boolean in " + list.render());
        };
    }

    ArithExpr<IntSort> toInt(SExpr expr) {
        if (expr instanceof SExpr.Atom atom) {
            String token = atom.token();
            if (INTEGER.matcher(token).matches()) {
                return ctx.mkInt(token);
            }
            if (token.equals("true") || token.equals("false")) {
                throw new Z3TermException("boolean literal " + token + " used as an integer");
            }
            return intSymbol(requireIdentifier(token));
        }

        SExpr.ListExpr list = (SExpr.ListExpr) expr;
        String head = requireHead(list);
        List<SExpr> args = list.args();
        if (args.isEmpty()) {
            throw new Z3TermException("'" + head + "' without operands");
        }
        switch (head) {
            case "+": {
                ArithExpr<IntSort> sum = toInt(args.get(0));
                for (SExpr arg : args.subList(1, args.size())) {
                    sum = ctx.mkAdd(sum, toInt(arg));
                }
                return sum;
            }
            case "-": {
                if (args.size() == 1) {
                    return ctx.mkUnaryMinus(toInt(args.get(0)));
                }
                ArithExpr<IntSort> difference = toInt(args.get(0));
                for (SExpr arg : args.subList(1, args.size())) {
                    difference = ctx.mkSub(difference, toInt(arg));
                }
                return difference;
            }
            case "*": {
                ArithExpr<IntSort> product = toInt(args.get(0));
                for (SExpr arg : args.subList(1, args.size())) {
                    product = ctx.mkMul(product, toInt(arg));
                }
                return product;
            }
            case "/":
                return ctx.mkDiv(toInt(binaryArgs(list).get(0)), toInt(binaryArgs(list).get(1)));
            case "mod":
                return ctx.mkMod(toInt(binaryArgs(list).get(0)), toInt(binaryArgs(list).get(1)));
            default:
                throw new Z3TermException("'" + head + "' does not yield an integer in " + list.render());
        }
    }

    /**
     * @return true when the term is boolean-valued by its shape or by a scanned boolean use of its symbol
     */
    boolean isBoolean(SExpr expr) {
        if (expr instanceof SExpr.Atom atom) {
            String token = atom.token();
            return token.equals("true") || token.equals("false") || booleanNames.contains(token);
        }
        String head = ((SExpr.ListExpr) expr).head();
        return head != null && BOOLEAN_HEADS.contains(head);
    }

    private BoolExpr equality(List<SExpr> operands) {
        SExpr left = operands.get(0);
        SExpr right = operands.get(1);
        if (isBoolean(left) || isBoolean(right)) {
            return ctx.mkEq(toBool(left), toBool(right));
        }
        return ctx.mkEq(toInt(left), toInt(right));
    }

    private BoolExpr[] boolArgs(List<SExpr> args) {
        List<BoolExpr> terms = new ArrayList<>();
        for (SExpr arg : args) {
            terms.add(toBool(arg));
        }
        return terms.toArray(new BoolExpr[0]);
    }

    private BoolExpr boolSymbol(String name) {
        if (intSymbols.containsKey(name)) {
            throw new Z3TermException("'" + name + "' is used both as an integer and as a boolean");
        }
        return boolSymbols.computeIfAbsent(name, ctx::mkBoolConst);
    }

    private IntExpr intSymbol(String name) {
        if (boolSymbols.containsKey(name)) {
            throw new Z3TermException("'" + name + "' is used both as a boolean and as an integer");
        }
        return intSymbols.computeIfAbsent(name, ctx::mkIntConst);
    }

    private static String requireIdentifier(String token) {
        if (!IDENTIFIER.matcher(token).matches()) {
            throw new Z3TermException("'" + token + "' is neither a decimal integer nor an identifier");
        }
        return token;
    }

    private static String requireHead(SExpr.ListExpr list) {
        String head = list.head();
        if (head == null) {
            throw new Z3TermException("malformed term " + list.render());
        }
        return head;
    }

    private static SExpr single(SExpr.ListExpr list) {
        if (list.args().size() != 1) {
            throw new Z3TermException("expected one operand in " + list.render());
        }
        return list.args().get(0);
    }

    private static List<SExpr> binaryArgs(SExpr.ListExpr list) {
        if (list.args().size() != 2) {
            throw new Z3TermException("expected two operands in " + list.render());
        }
        return list.args();
    }
}
