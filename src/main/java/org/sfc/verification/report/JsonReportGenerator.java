package org.sfc.verification.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sfc.verification.containment.models.ContainmentResult;
import org.sfc.verification.containment.models.PathMatch;
import org.sfc.verification.path.models.CutPointPath;

import java.io.File;
import java.io.IOException;
import java.util.List;

public class JsonReportGenerator {

    public static final String TITLE = "SFC Containment Verification Report";
    public static final String CONTAINED_DESCRIPTION =
            "All paths of Model 1 are equivalent to some path of Model 2 (Model 1 is contained in Model 2).";
    public static final String NOT_CONTAINED_DESCRIPTION =
            "There are paths in Model 1 that are not matched in Model 2 (Containment does NOT hold).";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Builds the JSON report tree: cut points and paths of both models, the path mapping and the verdict.
     */
    public static ObjectNode generate(ContainmentResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("title", TITLE);

        ObjectNode cutPoints = root.putObject("cut_points");
        addStrings(cutPoints.putArray("model1"), result.cutpoints1());
        addStrings(cutPoints.putArray("model2"), result.cutpoints2());

        ObjectNode paths = root.putObject("paths");
        addPaths(paths.putArray("model1"), result.paths1());
        addPaths(paths.putArray("model2"), result.paths2());

        ObjectNode mapping = root.putObject("path_mapping");
        ArrayNode matched = mapping.putArray("matched_paths");
        for (PathMatch match : result.matches1()) {
            ObjectNode entry = matched.addObject();
            entry.set("model1_path", pathNode(match.path1()));
            entry.set("model2_path", pathNode(match.path2()));
        }
        addPaths(mapping.putArray("unmatched_paths"), result.unmatched1());

        ObjectNode verdict = root.putObject("containment_result");
        verdict.put("contained", result.contained());
        verdict.put("description", result.contained() ? CONTAINED_DESCRIPTION : NOT_CONTAINED_DESCRIPTION);
        verdict.put("unmatched_path_count", result.unmatched1().size());
        verdict.put("matched_paths_count", result.matches1().size());
        return root;
    }

    public static void write(ContainmentResult result, String outputFilePath) {
        try {
            mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(new File(outputFilePath), generate(result));
        } catch (IOException e) {
            throw new RuntimeException("Error writing JSON report " + outputFilePath, e);
        }
    }

    private static ObjectNode pathNode(CutPointPath path) {
        ObjectNode node = mapper.createObjectNode();
        node.put("from", path.from());
        node.put("to", path.to());
        addStrings(node.putArray("transitions"), path.transitions());
        node.put("condition", path.cond());
        node.put("data_transformation", path.subst());
        return node;
    }

    private static void addPaths(ArrayNode array, List<CutPointPath> paths) {
        paths.forEach(path -> array.add(pathNode(path)));
    }

    private static void addStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }
}
