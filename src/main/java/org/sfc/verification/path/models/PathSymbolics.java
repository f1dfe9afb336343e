package org.sfc.verification.path.models;

/**
 * Symbolic summary of a transition sequence.
 *
 * @param cond  conjunction of the non-trivial guards, in prefix form
 * @param subst conjunction of {@code (= var expr)} facts over entry-time values, in prefix form
 */
public record PathSymbolics(String cond, String subst) {
}
