package org.sfc.verification.expression.models;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Node of a parsed prefix expression such as {@code (and (> i 0) flag)}.
 */
public sealed interface SExpr permits SExpr.Atom, SExpr.ListExpr {

    /**
     * @return the node rendered back into prefix text
     */
    String render();

    record Atom(String token) implements SExpr {
        @Override
        public String render() {
            return token;
        }
    }

    record ListExpr(List<SExpr> items) implements SExpr {
        public ListExpr {
            items = List.copyOf(items);
        }

        /**
         * @return the operator symbol, or null when the head is itself a list or the list is empty
         */
        public String head() {
            if (items.isEmpty() || !(items.get(0) instanceof Atom atom)) {
                return null;
            }
            return atom.token();
        }

        public List<SExpr> args() {
            return items.isEmpty() ? List.of() : items.subList(1, items.size());
        }

        @Override
        public String render() {
            return items.stream().map(SExpr::render).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
