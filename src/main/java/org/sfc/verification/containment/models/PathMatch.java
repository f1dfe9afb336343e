package org.sfc.verification.containment.models;

import org.sfc.verification.path.models.CutPointPath;

/**
 * A path of the first model and the path of the second model found equivalent to it.
 */
public record PathMatch(CutPointPath path1, CutPointPath path2) {
}
