package org.sfc.verification.petrinet.models;

/**
 * A place of the token-flow graph. There is one place per SFC step.
 *
 * @param name     the step name
 * @param function the step's entry assignment text
 */
public record Place(
        String name,
        String function
) {
}
