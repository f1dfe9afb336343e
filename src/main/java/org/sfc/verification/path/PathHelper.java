package org.sfc.verification.path;

import org.sfc.verification.path.models.CutPointPath;
import org.sfc.verification.path.models.PathSymbolics;
import org.sfc.verification.petrinet.PetriNetHelper;
import org.sfc.verification.petrinet.models.PetriNet;
import org.sfc.verification.petrinet.models.PlaceTransition;
import org.sfc.verification.sfc.models.Sfc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PathHelper {
    private static final Logger log = LoggerFactory.getLogger(PathHelper.class);

    /**
     * Enumerates every cut point to cut point path of the graph and computes its symbolic artifacts.
     * <p>
     * A depth-first search starts at every cut point. A branch ends when it reaches a cut point:
     * a different one closes and records the path, the start itself is dropped. The visited set of
     * (place, transition) pairs belongs to the current branch only, so a place can appear on paths
     * from several cut points and a cycle is followed at most once per branch.
     *
     * @param sfc              the process model (variables and step assignments)
     * @param net              the token-flow graph built from {@code sfc}
     * @param cutPoints        the cut points of {@code net}
     * @param allowedVariables variables kept in each data transformation; null keeps all
     * @return the paths, grouped by starting cut point in {@code cutPoints} order
     */
    public static List<CutPointPath> enumeratePaths(Sfc sfc, PetriNet net, List<String> cutPoints,
                                                    Set<String> allowedVariables) {
        Map<String, Set<String>> outgoing = PetriNetHelper.outgoingTransitions(net);
        Map<String, Set<String>> targets = PetriNetHelper.transitionTargets(net);
        Set<String> cutPointSet = new LinkedHashSet<>(cutPoints);
        SymbolicComposer composer = new SymbolicComposer(sfc, net, targets);

        List<CutPointPath> paths = new ArrayList<>();
        for (String cutPoint : cutPoints) {
            PathSearch search = new PathSearch(cutPoint, cutPointSet, outgoing, targets, composer, allowedVariables, paths);
            search.descend(cutPoint, new ArrayList<>(), new HashSet<>());
        }

        log.debug("Enumerated {} cut point paths over {} cut points", paths.size(), cutPoints.size());
        return paths;
    }

    /**
     * Enumerates paths keeping every variable's facts.
     */
    public static List<CutPointPath> enumeratePaths(Sfc sfc, PetriNet net, List<String> cutPoints) {
        return enumeratePaths(sfc, net, cutPoints, null);
    }

    private record PathSearch(String start,
                              Set<String> cutPoints,
                              Map<String, Set<String>> outgoing,
                              Map<String, Set<String>> targets,
                              SymbolicComposer composer,
                              Set<String> allowedVariables,
                              List<CutPointPath> paths) {

        void descend(String place, List<String> transitions, Set<PlaceTransition> visited) {
            if (!transitions.isEmpty() && cutPoints.contains(place)) {
                if (!place.equals(start)) {
                    close(place, transitions);
                }
                return;
            }

            for (String transition : outgoing.getOrDefault(place, Set.of())) {
                for (String next : targets.getOrDefault(transition, Set.of())) {
                    PlaceTransition step = new PlaceTransition(next, transition);
                    if (visited.add(step)) {
                        transitions.add(transition);
                        descend(next, transitions, visited);
                        transitions.remove(transitions.size() - 1);
                        visited.remove(step);
                    }
                }
            }
        }

        private void close(String end, List<String> transitions) {
            PathSymbolics symbolics = composer.compose(transitions, allowedVariables);
            paths.add(CutPointPath.builder()
                    .from(start)
                    .to(end)
                    .transitions(transitions)
                    .cond(symbolics.cond())
                    .subst(symbolics.subst())
                    .build());
        }
    }
}
