package org.sfc.verification.petrinet.models;

/**
 * A place paired with a transition on a traversal; used to expand each edge once per search.
 */
public record PlaceTransition(String place, String transition) {
}
