package org.sfc.verification.petrinet.models;

import java.util.List;
import java.util.Set;

/**
 * Token-flow view of an SFC. Built once per verification run and never mutated.
 *
 * @param places         one place per step, in step declaration order
 * @param transitions    one transition per SFC transition, in declaration order
 * @param inputArcs      place to transition arcs, one per source step
 * @param outputArcs     transition to place arcs, one per target step
 * @param initialMarking the place holding the initial token
 */
public record PetriNet(
        List<Place> places,
        List<NetTransition> transitions,
        List<InputArc> inputArcs,
        List<OutputArc> outputArcs,
        Set<String> initialMarking
) {
    public PetriNet {
        places = List.copyOf(places);
        transitions = List.copyOf(transitions);
        inputArcs = List.copyOf(inputArcs);
        outputArcs = List.copyOf(outputArcs);
        initialMarking = Set.copyOf(initialMarking);
    }

    public List<String> placeNames() {
        return places.stream().map(Place::name).toList();
    }

    public NetTransition transition(String id) {
        return transitions.stream()
                .filter(t -> t.id().equals(id))
                .findFirst()
                .orElse(null);
    }
}
