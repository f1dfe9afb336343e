package org.sfc.verification.report;

import org.sfc.verification.path.models.CutPointPath;

import java.util.List;

/**
 * Plain-text table of unmatched paths, one row per path.
 */
public class UnmatchedPathTable {

    public static final String HEADER = "From | To | Transitions | Condition | Data-Transformation";

    /**
     * @return the table, or an empty string when {@code paths} is empty
     */
    public static String format(List<CutPointPath> paths) {
        if (paths == null || paths.isEmpty()) {
            return "";
        }
        StringBuilder table = new StringBuilder(HEADER).append('\n');
        table.append("-".repeat(HEADER.length())).append('\n');
        for (CutPointPath path : paths) {
            table.append(path.from()).append(" | ")
                    .append(path.to()).append(" | ")
                    .append(String.join(", ", path.transitions())).append(" | ")
                    .append(path.cond()).append(" | ")
                    .append(path.subst()).append('\n');
        }
        return table.toString();
    }
}
