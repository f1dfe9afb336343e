package org.sfc.verification.path.models;

import lombok.Builder;

import java.util.List;

/**
 * A transition sequence between two distinct cut points with no cut point in between.
 *
 * @param from        the starting cut point
 * @param to          the ending cut point
 * @param transitions transition ids in firing order
 * @param cond        path condition in prefix form ({@code true} when unguarded)
 * @param subst       data transformation in prefix form: equalities over entry-time values
 */
@Builder
public record CutPointPath(
        String from,
        String to,
        List<String> transitions,
        String cond,
        String subst
) {
    public CutPointPath {
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public String describe() {
        return from + " -> " + to + " " + transitions;
    }
}
