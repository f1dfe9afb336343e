package org.sfc.verification.petrinet.models;

/**
 * Arc from a transition into a place.
 */
public record OutputArc(String transition, String place) {
}
