package org.sfc.verification.expression;

import org.sfc.verification.expression.models.SExpr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the fully parenthesised prefix form produced by {@link ExpressionTranslator}.
 * <p>
 * Grammar: {@code expr := atom | '(' expr* ')'}; atoms are any run of characters other than
 * whitespace and parentheses.
 */
public class PrefixParser {

    /**
     * @param text prefix expression text
     * @return the parsed term
     * @throws PrefixSyntaxException if the text is empty, unbalanced or holds more than one term
     */
    public static SExpr parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PrefixSyntaxException("Empty expression");
        }
        List<String> tokens = tokenize(text);
        int[] position = {0};
        SExpr expr = parse(tokens, position);
        if (position[0] != tokens.size()) {
            throw new PrefixSyntaxException("Unexpected trailing input in '" + text + "'");
        }
        return expr;
    }

    static List<String> tokenize(String text) {
        String spaced = text.replace("(", " ( ").replace(")", " ) ").trim();
        return new ArrayList<>(Arrays.asList(spaced.split("\\s+")));
    }

    private static SExpr parse(List<String> tokens, int[] position) {
        if (position[0] >= tokens.size()) {
            throw new PrefixSyntaxException("Unexpected end of expression");
        }
        String token = tokens.get(position[0]++);
        if (token.equals(")")) {
            throw new PrefixSyntaxException("Unexpected ')'");
        }
        if (!token.equals("(")) {
            return new SExpr.Atom(token);
        }

        List<SExpr> items = new ArrayList<>();
        while (true) {
            if (position[0] >= tokens.size()) {
                throw new PrefixSyntaxException("Missing ')'");
            }
            if (tokens.get(position[0]).equals(")")) {
                position[0]++;
                return new SExpr.ListExpr(items);
            }
            items.add(parse(tokens, position));
        }
    }
}
