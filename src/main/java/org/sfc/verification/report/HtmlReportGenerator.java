package org.sfc.verification.report;

import freemarker.core.HTMLOutputFormat;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.sfc.verification.containment.models.ContainmentResult;
import org.sfc.verification.containment.models.PathMatch;
import org.sfc.verification.path.models.CutPointPath;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a containment result as a standalone HTML page from {@value #TEMPLATE_RESOURCE_PATH}.
 * Every value is HTML-escaped by the template's output format.
 */
public class HtmlReportGenerator {

    private static final String TEMPLATE_RESOURCE_PATH = "templates/containment_report.ftl";

    public static String generate(ContainmentResult result) {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setOutputFormat(HTMLOutputFormat.INSTANCE);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);

        ClassLoader cl = HtmlReportGenerator.class.getClassLoader();
        try (InputStream is = cl.getResourceAsStream(TEMPLATE_RESOURCE_PATH)) {
            if (is == null) {
                throw new IllegalStateException("Template resource not found: " + TEMPLATE_RESOURCE_PATH);
            }
            Template template;
            try (Reader templateReader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                template = new Template("containment_report.ftl", templateReader, cfg);
            }
            StringWriter out = new StringWriter();
            template.process(toModel(result), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new RuntimeException("Error rendering " + TEMPLATE_RESOURCE_PATH, e);
        }
    }

    public static void write(ContainmentResult result, String outputFilePath) {
        String html = generate(result);
        try {
            Files.writeString(Path.of(outputFilePath), html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Error writing HTML report " + outputFilePath, e);
        }
    }

    // the template sees plain maps and lists only
    private static Map<String, Object> toModel(ContainmentResult result) {
        Map<String, Object> model = new HashMap<>();
        model.put("title", JsonReportGenerator.TITLE);
        model.put("cutPoints1", result.cutpoints1());
        model.put("cutPoints2", result.cutpoints2());
        model.put("variables", result.commonVariables());
        model.put("paths1", toRows(result.paths1()));
        model.put("paths2", toRows(result.paths2()));
        model.put("unmatched", toRows(result.unmatched1()));

        List<Map<String, Object>> matches = new ArrayList<>();
        for (PathMatch match : result.matches1()) {
            Map<String, Object> row = new HashMap<>();
            row.put("path1", toRow(match.path1()));
            row.put("path2", toRow(match.path2()));
            matches.add(row);
        }
        model.put("matches", matches);

        model.put("contained", result.contained());
        model.put("description", result.contained()
                ? JsonReportGenerator.CONTAINED_DESCRIPTION
                : JsonReportGenerator.NOT_CONTAINED_DESCRIPTION);
        return model;
    }

    private static List<Map<String, Object>> toRows(List<CutPointPath> paths) {
        List<Map<String, Object>> rows = new ArrayList<>();
        paths.forEach(path -> rows.add(toRow(path)));
        return rows;
    }

    private static Map<String, Object> toRow(CutPointPath path) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("from", path.from());
        row.put("to", path.to());
        row.put("transitions", String.join(", ", path.transitions()));
        row.put("condition", path.cond());
        row.put("dataTransformation", path.subst());
        return row;
    }
}
