package org.sfc.verification;

import org.sfc.verification.config.VerifierConfig;
import org.sfc.verification.config.VerifierConfigHelper;
import org.sfc.verification.containment.ContainmentChecker;
import org.sfc.verification.containment.models.ContainmentResult;
import org.sfc.verification.petrinet.PetriNetHelper;
import org.sfc.verification.report.DotExporter;
import org.sfc.verification.report.HtmlReportGenerator;
import org.sfc.verification.report.JsonReportGenerator;
import org.sfc.verification.report.UnmatchedPathTable;
import org.sfc.verification.sfc.SfcHelper;
import org.sfc.verification.sfc.SfcModelException;
import org.sfc.verification.sfc.models.Sfc;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * Command line: {@code Main <model1.json> <model2.json> [--out <dir>] [--config <config.json>]}.
 * <p>
 * Exits with 0 when model 1 is contained in model 2, 1 when it is not, 2 on usage or load errors.
 */
public class Main {
    static final int CONTAINED = 0;
    static final int NOT_CONTAINED = 1;
    static final int ERROR = 2;

    private static final String USAGE = "Usage: Main <model1.json> <model2.json> [--out <dir>] [--config <config.json>]";

    // ------ command line
    private String model1Path;
    private String model2Path;
    private String outDir = "out";
    private String configPath;

    // ------ loaded inputs
    private VerifierConfig config;
    private Sfc sfc1;
    private Sfc sfc2;

    private final PrintStream out;

    Main(PrintStream out) {
        this.out = out;
    }

    int run(String[] args) {
        if (!parseArguments(args)) {
            out.println(USAGE);
            return ERROR;
        }
        try {
            loadInputs();
        } catch (SfcModelException e) {
            out.println("Cannot load models: " + e.getMessage());
            return ERROR;
        } catch (IOException | IllegalStateException e) {
            out.println("Cannot load configuration " + configPath + ": " + e.getMessage());
            return ERROR;
        }

        ContainmentResult result;
        Path folder;
        try {
            result = new ContainmentChecker(config).check(sfc1, sfc2);
            folder = writeOutputs(result);
        } catch (RuntimeException e) {
            out.println("Verification failed: " + e.getMessage());
            return ERROR;
        }

        out.println(result.contained()
                ? JsonReportGenerator.CONTAINED_DESCRIPTION
                : JsonReportGenerator.NOT_CONTAINED_DESCRIPTION);
        out.println("Matched paths: " + result.matches1().size() + ", unmatched paths: " + result.unmatched1().size());
        String table = UnmatchedPathTable.format(result.unmatched1());
        if (!table.isEmpty()) {
            out.println(table);
        }
        out.println("Reports written to " + folder);
        return result.contained() ? CONTAINED : NOT_CONTAINED;
    }

    private boolean parseArguments(String[] args) {
        int positional = 0;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--out") || arg.equals("--config")) {
                if (i + 1 >= args.length) {
                    return false;
                }
                if (arg.equals("--out")) {
                    outDir = args[++i];
                } else {
                    configPath = args[++i];
                }
            } else if (arg.startsWith("--")) {
                return false;
            } else if (positional == 0) {
                model1Path = arg;
                positional++;
            } else if (positional == 1) {
                model2Path = arg;
                positional++;
            } else {
                return false;
            }
        }
        return positional == 2;
    }

    private void loadInputs() throws IOException {
        config = VerifierConfigHelper.loadConfig(configPath);
        VerifierConfigHelper.validateConfig(config);
        SfcHelper.validate(model1Path);
        SfcHelper.validate(model2Path);
        sfc1 = SfcHelper.loadFromFile(model1Path, config.strictModelValidation);
        sfc2 = SfcHelper.loadFromFile(model2Path, config.strictModelValidation);
    }

    private Path writeOutputs(ContainmentResult result) {
        Path folder = Path.of(outDir, result.contained() ? "success" : "failed");
        String baseName = baseName(model2Path);
        try {
            Files.createDirectories(folder);
            Files.copy(Path.of(model2Path), folder.resolve(Path.of(model2Path).getFileName()),
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Error preparing output folder " + folder, e);
        }

        for (String format : config.reportFormats) {
            switch (format.toLowerCase(Locale.ROOT)) {
                case "json" -> JsonReportGenerator.write(result,
                        folder.resolve(baseName + "_report.json").toString());
                case "html" -> HtmlReportGenerator.write(result,
                        folder.resolve(baseName + "_report.html").toString());
                case "dot" -> {
                    DotExporter.write(DotExporter.sfcToDot(sfc2), folder.resolve(baseName + "_sfc.dot").toString());
                    DotExporter.write(DotExporter.petriNetToDot(PetriNetHelper.fromSfc(sfc2)),
                            folder.resolve(baseName + "_petrinet.dot").toString());
                }
                default -> throw new IllegalStateException("Unknown report format " + format);
            }
        }
        return folder;
    }

    static String baseName(String path) {
        String fileName = Path.of(path).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public static void main(String[] args) {
        int exitCode = new Main(System.out).run(args);
        System.exit(exitCode);
    }
}
