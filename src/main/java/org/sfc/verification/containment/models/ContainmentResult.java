package org.sfc.verification.containment.models;

import lombok.Builder;
import org.sfc.verification.path.models.CutPointPath;
import org.sfc.verification.sfc.models.Sfc;

import java.util.List;

/**
 * Outcome of checking that every path of the first model has an equivalent path in the second.
 *
 * @param sfc1              the candidate model
 * @param sfc2              the reference model
 * @param commonVariables   sorted variables declared by both models, the ones compared
 * @param cutpoints1        cut points of the first model
 * @param cutpoints2        cut points of the second model
 * @param paths1            paths of the first model
 * @param paths2            paths of the second model
 * @param matches1          matched paths of the first model, in {@code paths1} order
 * @param unmatched1        paths of the first model with no equivalent, in {@code paths1} order
 * @param contained         true exactly when {@code unmatched1} is empty
 */
@Builder
public record ContainmentResult(
        Sfc sfc1,
        Sfc sfc2,
        List<String> commonVariables,
        List<String> cutpoints1,
        List<String> cutpoints2,
        List<CutPointPath> paths1,
        List<CutPointPath> paths2,
        List<PathMatch> matches1,
        List<CutPointPath> unmatched1,
        boolean contained
) {
    public ContainmentResult {
        commonVariables = commonVariables == null ? List.of() : List.copyOf(commonVariables);
        cutpoints1 = cutpoints1 == null ? List.of() : List.copyOf(cutpoints1);
        cutpoints2 = cutpoints2 == null ? List.of() : List.copyOf(cutpoints2);
        paths1 = paths1 == null ? List.of() : List.copyOf(paths1);
        paths2 = paths2 == null ? List.of() : List.copyOf(paths2);
        matches1 = matches1 == null ? List.of() : List.copyOf(matches1);
        unmatched1 = unmatched1 == null ? List.of() : List.copyOf(unmatched1);
    }
}
