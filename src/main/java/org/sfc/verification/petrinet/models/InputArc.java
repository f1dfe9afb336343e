package org.sfc.verification.petrinet.models;

/**
 * Arc from a place into a transition.
 */
public record InputArc(String place, String transition) {
}
