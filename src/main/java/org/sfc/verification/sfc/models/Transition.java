package org.sfc.verification.sfc.models;

import java.util.List;

/**
 * An SFC transition. Parallel branches are expressed by more than one source or target step.
 *
 * @param src   names of the steps deactivated by the transition
 * @param tgt   names of the steps activated by the transition
 * @param guard the firing condition
 */
public record Transition(
        List<String> src,
        List<String> tgt,
        Guard guard
) {
    public Transition {
        src = src == null ? List.of() : List.copyOf(src);
        tgt = tgt == null ? List.of() : List.copyOf(tgt);
        guard = guard == null ? Guard.of(null) : guard;
    }

    // Constructor for the common single source / single target case
    public Transition(String src, String tgt, String guard) {
        this(List.of(src), List.of(tgt), Guard.of(guard));
    }
}
