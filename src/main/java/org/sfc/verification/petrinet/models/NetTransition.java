package org.sfc.verification.petrinet.models;

import org.sfc.verification.sfc.models.Guard;

/**
 * A transition of the token-flow graph, one per SFC transition.
 *
 * @param id    identifier of the form {@code t_<index>}
 * @param index position of the originating transition in the SFC
 * @param guard the originating transition's guard
 */
public record NetTransition(
        String id,
        int index,
        Guard guard
) {
    public static String idFor(int index) {
        return "t_" + index;
    }
}
