package org.sfc.verification.petrinet;

import org.sfc.verification.petrinet.models.InputArc;
import org.sfc.verification.petrinet.models.NetTransition;
import org.sfc.verification.petrinet.models.OutputArc;
import org.sfc.verification.petrinet.models.PetriNet;
import org.sfc.verification.petrinet.models.Place;
import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.sfc.models.Step;
import org.sfc.verification.sfc.models.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PetriNetHelper {
    private static final Logger log = LoggerFactory.getLogger(PetriNetHelper.class);

    /**
     * Builds the token-flow graph of an SFC.
     * <p>
     * Multi-source and multi-target transitions are exploded into one arc per step. Step names
     * referenced by a transition but never declared become extra places with no assignment,
     * appended after the declared steps; they are not reported as errors here.
     *
     * @param sfc the process model
     * @return the token-flow graph
     */
    public static PetriNet fromSfc(Sfc sfc) {
        Map<String, Place> places = new LinkedHashMap<>();
        for (Step step : sfc.steps()) {
            places.putIfAbsent(step.name(), new Place(step.name(), step.function()));
        }

        List<NetTransition> transitions = new ArrayList<>();
        List<InputArc> inputArcs = new ArrayList<>();
        List<OutputArc> outputArcs = new ArrayList<>();

        for (int i = 0; i < sfc.transitions().size(); i++) {
            Transition transition = sfc.transitions().get(i);
            String id = NetTransition.idFor(i);
            transitions.add(new NetTransition(id, i, transition.guard()));

            for (String src : transition.src()) {
                inputArcs.add(new InputArc(src, id));
                addImplicitPlace(places, src);
            }
            for (String tgt : transition.tgt()) {
                outputArcs.add(new OutputArc(id, tgt));
                addImplicitPlace(places, tgt);
            }
        }

        Set<String> initialMarking = new LinkedHashSet<>();
        if (sfc.initialStep() != null) {
            initialMarking.add(sfc.initialStep());
            addImplicitPlace(places, sfc.initialStep());
        }

        log.debug("Built token-flow graph: {} places, {} transitions, {} input arcs, {} output arcs",
                places.size(), transitions.size(), inputArcs.size(), outputArcs.size());

        return new PetriNet(new ArrayList<>(places.values()), transitions, inputArcs, outputArcs, initialMarking);
    }

    private static void addImplicitPlace(Map<String, Place> places, String name) {
        if (name != null && !places.containsKey(name)) {
            log.debug("Step '{}' is referenced but not declared, adding it as an empty place", name);
            places.put(name, new Place(name, ""));
        }
    }

    /**
     * @return place name to the transitions it feeds, for every place (empty set for sinks)
     */
    public static Map<String, Set<String>> outgoingTransitions(PetriNet net) {
        Map<String, Set<String>> outgoing = new LinkedHashMap<>();
        for (Place place : net.places()) {
            outgoing.put(place.name(), new LinkedHashSet<>());
        }
        for (InputArc arc : net.inputArcs()) {
            Set<String> transitions = outgoing.get(arc.place());
            if (transitions != null) {
                transitions.add(arc.transition());
            }
        }
        return outgoing;
    }

    /**
     * @return transition id to the places it marks, for every transition
     */
    public static Map<String, Set<String>> transitionTargets(PetriNet net) {
        Map<String, Set<String>> targets = new LinkedHashMap<>();
        for (NetTransition transition : net.transitions()) {
            targets.put(transition.id(), new LinkedHashSet<>());
        }
        for (OutputArc arc : net.outputArcs()) {
            Set<String> places = targets.get(arc.transition());
            if (places != null) {
                places.add(arc.place());
            }
        }
        return targets;
    }
}
