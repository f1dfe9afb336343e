package org.sfc.verification.sfc.models;

/**
 * An SFC step.
 *
 * @param name     the unique step name
 * @param function assignment statements executed on entry, e.g. {@code "i := 1; fact := 1"}
 */
public record Step(
        String name,
        String function
) {
    public Step {
        function = function == null ? "" : function;
    }
}
