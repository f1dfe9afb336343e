package org.sfc.verification.expression;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rewrites infix guards and assignment right-hand sides into the prefix form read by the
 * equivalence oracle, e.g. {@code a and (b > 2)} becomes {@code (and a (> b 2))}.
 * <p>
 * Text that cannot be parsed, or that uses constructs outside boolean connectives, comparisons
 * and {@code + - * / %}, is returned unchanged by {@link #translate(String)}. Integer literals are
 * written in decimal; other literals keep their lower-cased source text.
 */
public class ExpressionTranslator {
    private static final Logger log = LoggerFactory.getLogger(ExpressionTranslator.class);

    private static final Pattern AND_WORD = Pattern.compile("\\band\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OR_WORD = Pattern.compile("\\bor\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_WORD = Pattern.compile("\\bnot\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MOD_WORD = Pattern.compile("\\bmod\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRUE_WORD = Pattern.compile("\\btrue\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FALSE_WORD = Pattern.compile("\\bfalse\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Translates an infix expression, falling back to the original text when it cannot be translated.
     *
     * @param infix guard or right-hand side text
     * @return the prefix form, or {@code infix} unchanged
     */
    public static String translate(String infix) {
        return tryTranslate(infix, Map.of()).orElse(infix);
    }

    /**
     * Translates an infix expression, rendering every identifier bound in {@code bindings} as its
     * bound prefix text instead of its name.
     *
     * @param infix    guard or right-hand side text
     * @param bindings identifier to prefix text; unbound identifiers are kept as they are
     * @return the prefix form, or empty when the text cannot be translated
     */
    public static Optional<String> tryTranslate(String infix, Map<String, String> bindings) {
        if (infix == null || infix.isBlank()) {
            return Optional.empty();
        }
        try {
            Expression expression = StaticJavaParser.parseExpression(normalize(infix));
            return Optional.of(render(expression, bindings));
        } catch (ParseProblemException | UntranslatableExpressionException e) {
            log.debug("Leaving '{}' untranslated: {}", infix, firstLine(e.getMessage()));
            return Optional.empty();
        }
    }

    /**
     * Maps the alternative operator spellings onto the ones the parser reads:
     * word connectives become {@code && || !}, {@code <>} becomes {@code !=}, {@code mod} becomes
     * {@code %}, and boolean literals are lower-cased.
     */
    static String normalize(String infix) {
        String expr = infix.replace("<>", " != ");
        expr = AND_WORD.matcher(expr).replaceAll(" && ");
        expr = OR_WORD.matcher(expr).replaceAll(" || ");
        expr = NOT_WORD.matcher(expr).replaceAll(" ! ");
        expr = MOD_WORD.matcher(expr).replaceAll(" % ");
        expr = TRUE_WORD.matcher(expr).replaceAll("true");
        expr = FALSE_WORD.matcher(expr).replaceAll("false");
        return expr.trim();
    }

    private static String render(Expression expression, Map<String, String> bindings) {
        if (expression instanceof EnclosedExpr enclosed) {
            return render(enclosed.getInner(), bindings);
        }
        if (expression instanceof BinaryExpr binary) {
            return renderBinary(binary, bindings);
        }
        if (expression instanceof UnaryExpr unary) {
            String operand = render(unary.getExpression(), bindings);
            return switch (unary.getOperator()) {
                case LOGICAL_COMPLEMENT -> "(not " + operand + ")";
                case MINUS -> "(- " + operand + ")";
                case PLUS -> operand;
                default -> throw new UntranslatableExpressionException("operator " + unary.getOperator().asString());
            };
        }
        if (expression instanceof NameExpr name) {
            String identifier = name.getNameAsString();
            return bindings.getOrDefault(identifier, identifier);
        }
        if (expression instanceof BooleanLiteralExpr bool) {
            return String.valueOf(bool.getValue());
        }
        // hex, octal, binary, underscored and L-suffixed integers become plain decimals
        if (expression instanceof IntegerLiteralExpr integer) {
            return integer.asNumber().toString();
        }
        if (expression instanceof LongLiteralExpr longLiteral) {
            return longLiteral.asNumber().toString();
        }
        if (expression instanceof LiteralStringValueExpr literal) {
            return literal.getValue().toLowerCase(Locale.ROOT);
        }
        throw new UntranslatableExpressionException(expression.getClass().getSimpleName());
    }

    private static String renderBinary(BinaryExpr binary, Map<String, String> bindings) {
        BinaryExpr.Operator operator = binary.getOperator();
        if (operator == BinaryExpr.Operator.AND || operator == BinaryExpr.Operator.OR) {
            List<String> operands = new ArrayList<>();
            collectOperands(binary, operator, bindings, operands);
            String head = operator == BinaryExpr.Operator.AND ? "and" : "or";
            return "(" + head + " " + String.join(" ", operands) + ")";
        }

        String left = render(binary.getLeft(), bindings);
        String right = render(binary.getRight(), bindings);
        return switch (operator) {
            case EQUALS -> "(= " + left + " " + right + ")";
            case NOT_EQUALS -> "(not (= " + left + " " + right + "))";
            case LESS -> "(< " + left + " " + right + ")";
            case LESS_EQUALS -> "(<= " + left + " " + right + ")";
            case GREATER -> "(> " + left + " " + right + ")";
            case GREATER_EQUALS -> "(>= " + left + " " + right + ")";
            case PLUS -> "(+ " + left + " " + right + ")";
            case MINUS -> "(- " + left + " " + right + ")";
            case MULTIPLY -> "(* " + left + " " + right + ")";
            case DIVIDE -> "(/ " + left + " " + right + ")";
            case REMAINDER -> "(mod " + left + " " + right + ")";
            default -> throw new UntranslatableExpressionException("operator " + operator.asString());
        };
    }

    // a && b && c is one n-ary conjunction; (a && b) && c keeps its nesting
    private static void collectOperands(Expression expression, BinaryExpr.Operator operator,
                                        Map<String, String> bindings, List<String> operands) {
        if (expression instanceof BinaryExpr binary && binary.getOperator() == operator) {
            collectOperands(binary.getLeft(), operator, bindings, operands);
            collectOperands(binary.getRight(), operator, bindings, operands);
        } else {
            operands.add(render(expression, bindings));
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static class UntranslatableExpressionException extends RuntimeException {
        UntranslatableExpressionException(String construct) {
            super("unsupported construct " + construct);
        }
    }
}
