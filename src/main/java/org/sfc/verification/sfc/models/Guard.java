package org.sfc.verification.sfc.models;

import java.util.Locale;

/**
 * Firing condition of an SFC transition.
 * <p>
 * A transition is either taken unconditionally ({@link Always}) or when a boolean
 * expression holds ({@link Expression}). Transitions guarded by {@code init} (first activation)
 * or by the literal {@code true} are unconditional, so they contribute nothing to a path condition.
 */
public sealed interface Guard permits Guard.Always, Guard.Expression {

    String INIT_MARKER = "init";

    /**
     * @return the guard text as it appeared in the model (may be empty)
     */
    String text();

    /**
     * Classifies raw guard text from a model file.
     *
     * @param text guard text, may be null
     * @return {@link Always} for absent, blank, {@code true} or {@code init} guards, {@link Expression} otherwise
     */
    static Guard of(String text) {
        if (text == null || text.isBlank()) {
            return new Always("");
        }
        String trimmed = text.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals(INIT_MARKER)) {
            return new Always(trimmed);
        }
        return new Expression(trimmed);
    }

    record Always(String text) implements Guard {
        public Always {
            text = text == null ? "" : text;
        }
    }

    record Expression(String text) implements Guard {
    }
}
