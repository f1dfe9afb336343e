package org.sfc.verification.cutpoint;

import org.sfc.verification.petrinet.PetriNetHelper;
import org.sfc.verification.petrinet.models.PetriNet;
import org.sfc.verification.petrinet.models.Place;
import org.sfc.verification.petrinet.models.PlaceTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the places that bound independently analysed path segments.
 * <p>
 * A place is a cut point when it is initially marked, is a decision point (more than one
 * outgoing transition), is terminal (no outgoing transition), or lies on a cycle. Loop detection
 * runs one reachability search per place, so the cost is O(P * (P + T)); models are expected
 * to have tens of nodes.
 */
public class CutPointHelper {
    private static final Logger log = LoggerFactory.getLogger(CutPointHelper.class);

    /**
     * @param net the token-flow graph
     * @return sorted, de-duplicated cut point names
     */
    public static List<String> findCutPoints(PetriNet net) {
        Map<String, Set<String>> outgoing = PetriNetHelper.outgoingTransitions(net);
        Map<String, Set<String>> targets = PetriNetHelper.transitionTargets(net);

        Set<String> cutPoints = new TreeSet<>(net.initialMarking());

        for (Map.Entry<String, Set<String>> entry : outgoing.entrySet()) {
            int fanOut = entry.getValue().size();
            if (fanOut > 1 || fanOut == 0) {
                cutPoints.add(entry.getKey());
            }
        }

        for (Place place : net.places()) {
            if (isOnCycle(place.name(), outgoing, targets)) {
                cutPoints.add(place.name());
            }
        }

        if (net.places().size() > 200) {
            log.warn("Cut point search on {} places is quadratic and may be slow", net.places().size());
        }
        log.debug("Cut points: {}", cutPoints);
        return new ArrayList<>(cutPoints);
    }

    /**
     * Depth-first search from the successors of {@code start}; true when {@code start} is reached again.
     */
    static boolean isOnCycle(String start,
                             Map<String, Set<String>> outgoing,
                             Map<String, Set<String>> targets) {
        Deque<String> stack = new ArrayDeque<>();
        Set<PlaceTransition> visited = new HashSet<>();

        for (String transition : outgoing.getOrDefault(start, Set.of())) {
            stack.addAll(targets.getOrDefault(transition, Set.of()));
        }

        while (!stack.isEmpty()) {
            String place = stack.pop();
            if (place.equals(start)) {
                return true;
            }
            for (String transition : outgoing.getOrDefault(place, Set.of())) {
                if (visited.add(new PlaceTransition(place, transition))) {
                    stack.addAll(targets.getOrDefault(transition, Set.of()));
                }
            }
        }
        return false;
    }
}
