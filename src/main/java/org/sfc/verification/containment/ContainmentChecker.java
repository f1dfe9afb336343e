package org.sfc.verification.containment;

import org.sfc.verification.config.VerifierConfig;
import org.sfc.verification.containment.models.ContainmentResult;
import org.sfc.verification.containment.models.PathMatch;
import org.sfc.verification.cutpoint.CutPointHelper;
import org.sfc.verification.path.PathHelper;
import org.sfc.verification.path.models.CutPointPath;
import org.sfc.verification.petrinet.PetriNetHelper;
import org.sfc.verification.petrinet.models.PetriNet;
import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.smt.EquivalenceOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks that the behaviour of one SFC is contained in another's: every cut point path of the
 * first model must have a path in the second with an equivalent condition and data transformation
 * over the variables both models declare.
 */
public class ContainmentChecker {
    private static final Logger log = LoggerFactory.getLogger(ContainmentChecker.class);

    private final EquivalenceOracle oracle;
    private final boolean parallelMatching;

    public ContainmentChecker() {
        this(VerifierConfig.defaults());
    }

    public ContainmentChecker(VerifierConfig config) {
        this(new EquivalenceOracle(config), config.parallelMatching);
    }

    public ContainmentChecker(EquivalenceOracle oracle, boolean parallelMatching) {
        this.oracle = oracle;
        this.parallelMatching = parallelMatching;
    }

    /**
     * @param sfc1 the candidate model
     * @param sfc2 the reference model
     * @return matched and unmatched paths of {@code sfc1} and the verdict
     */
    public ContainmentResult check(Sfc sfc1, Sfc sfc2) {
        PetriNet net1 = PetriNetHelper.fromSfc(sfc1);
        PetriNet net2 = PetriNetHelper.fromSfc(sfc2);
        List<String> cutpoints1 = CutPointHelper.findCutPoints(net1);
        List<String> cutpoints2 = CutPointHelper.findCutPoints(net2);

        Set<String> common = new TreeSet<>(sfc1.variables());
        common.retainAll(sfc2.variables());
        List<String> commonVariables = new ArrayList<>(common);

        List<CutPointPath> paths1 = PathHelper.enumeratePaths(sfc1, net1, cutpoints1, common);
        List<CutPointPath> paths2 = PathHelper.enumeratePaths(sfc2, net2, cutpoints2, common);
        log.debug("Comparing {} paths against {} paths over variables {}", paths1.size(), paths2.size(), commonVariables);

        Stream<CutPointPath> candidates = parallelMatching ? paths1.parallelStream() : paths1.stream();
        // collect keeps encounter order, also on a parallel stream
        List<Optional<CutPointPath>> found = candidates
                .map(path1 -> findMatch(path1, paths2, commonVariables))
                .collect(Collectors.toList());

        List<PathMatch> matches = new ArrayList<>();
        List<CutPointPath> unmatched = new ArrayList<>();
        for (int i = 0; i < paths1.size(); i++) {
            CutPointPath path1 = paths1.get(i);
            Optional<CutPointPath> match = found.get(i);
            if (match.isPresent()) {
                matches.add(new PathMatch(path1, match.get()));
            } else {
                log.debug("No equivalent for path {}", path1.describe());
                unmatched.add(path1);
            }
        }

        boolean contained = unmatched.isEmpty();
        log.info("Containment {}: {} of {} paths matched", contained ? "holds" : "does not hold",
                matches.size(), paths1.size());

        return ContainmentResult.builder()
                .sfc1(sfc1)
                .sfc2(sfc2)
                .commonVariables(commonVariables)
                .cutpoints1(cutpoints1)
                .cutpoints2(cutpoints2)
                .paths1(paths1)
                .paths2(paths2)
                .matches1(matches)
                .unmatched1(unmatched)
                .contained(contained)
                .build();
    }

    private Optional<CutPointPath> findMatch(CutPointPath path1, List<CutPointPath> paths2, List<String> variables) {
        for (CutPointPath path2 : paths2) {
            if (oracle.areConditionsEquivalent(path1.cond(), path2.cond())
                    && oracle.areDataTransformationsEquivalent(path1.subst(), path2.subst(), variables)) {
                return Optional.of(path2);
            }
        }
        return Optional.empty();
    }
}
