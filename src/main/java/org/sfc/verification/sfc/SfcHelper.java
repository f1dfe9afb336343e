package org.sfc.verification.sfc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.sfc.verification.sfc.models.Guard;
import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.sfc.models.SfcFile;
import org.sfc.verification.sfc.models.Step;
import org.sfc.verification.sfc.models.StepEntry;
import org.sfc.verification.sfc.models.Transition;
import org.sfc.verification.sfc.models.TransitionEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class SfcHelper {
    private static final Logger log = LoggerFactory.getLogger(SfcHelper.class);

    private static final String SCHEMA_RESOURCE_PATH = "schemas/sfc_model_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Validates an SFC model file against the model JSON schema.
     *
     * @param modelFilePath path to the JSON model file
     * @throws SfcModelException if the file cannot be read or does not match the schema
     */
    public static void validate(String modelFilePath) {
        JsonNode modelNode;
        try {
            modelNode = mapper.readTree(new File(modelFilePath));
        } catch (IOException e) {
            throw new SfcModelException("Error reading SFC file '" + modelFilePath + "'", e);
        }
        validateNode(modelNode, modelFilePath);
    }

    private static void validateNode(JsonNode modelNode, String source) {
        ClassLoader cl = SfcHelper.class.getClassLoader();
        try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));

            Set<ValidationMessage> errors = schema.validate(modelNode);
            if (!errors.isEmpty()) {
                List<String> problems = errors.stream()
                        .map(ValidationMessage::getMessage)
                        .sorted()
                        .collect(Collectors.toList());
                throw new SfcModelException("SFC file '" + source + "' is invalid", problems);
            }
        } catch (IOException e) {
            throw new SfcModelException("Error reading schema " + SCHEMA_RESOURCE_PATH, e);
        }
    }

    /**
     * Loads an SFC model from disk. Structural problems are logged, not raised.
     *
     * @param modelFilePath path to the JSON model file
     * @return the immutable model
     */
    public static Sfc loadFromFile(String modelFilePath) {
        return loadFromFile(modelFilePath, false);
    }

    /**
     * Loads an SFC model from disk.
     *
     * @param modelFilePath path to the JSON model file
     * @param strict        raise on structural problems instead of logging them
     * @return the immutable model
     * @throws SfcModelException if the file cannot be parsed, or in strict mode has structural problems
     */
    public static Sfc loadFromFile(String modelFilePath, boolean strict) {
        SfcFile sfcFile;
        try {
            sfcFile = mapper.readValue(new File(modelFilePath), SfcFile.class);
        } catch (IOException e) {
            throw new SfcModelException("Error parsing SFC file '" + modelFilePath + "': " + e.getMessage(), e);
        }
        return checkStructure(toSfc(sfcFile), modelFilePath, strict);
    }

    /**
     * Loads an SFC model from the classpath, validating it against the schema first.
     */
    public static Sfc loadFromClasspath(String classpathResource) {
        InputStream is = SfcHelper.class.getClassLoader().getResourceAsStream(classpathResource);
        if (is == null) {
            throw new IllegalArgumentException("SFC resource not found on classpath: " + classpathResource);
        }
        try (is) {
            JsonNode modelNode = mapper.readTree(is);
            validateNode(modelNode, classpathResource);
            SfcFile sfcFile = mapper.treeToValue(modelNode, SfcFile.class);
            return checkStructure(toSfc(sfcFile), classpathResource, false);
        } catch (IOException e) {
            throw new SfcModelException("Error parsing SFC resource '" + classpathResource + "': " + e.getMessage(), e);
        }
    }

    private static Sfc checkStructure(Sfc sfc, String source, boolean strict) {
        List<String> problems = SfcValidator.findProblems(sfc);
        if (!problems.isEmpty()) {
            if (strict) {
                throw new SfcModelException("SFC file '" + source + "' is malformed", problems);
            }
            problems.forEach(problem -> log.warn("{}: {}", source, problem));
        }
        log.debug("Loaded {}: {} steps, {} transitions, {} variables",
                source, sfc.steps().size(), sfc.transitions().size(), sfc.variables().size());
        return sfc;
    }

    /**
     * Converts the file representation into the immutable model.
     */
    public static Sfc toSfc(SfcFile sfcFile) {
        List<Step> steps = new ArrayList<>();
        if (sfcFile.steps != null) {
            for (StepEntry entry : sfcFile.steps) {
                steps.add(new Step(entry.name, entry.function));
            }
        }

        List<Transition> transitions = new ArrayList<>();
        if (sfcFile.transitions != null) {
            for (TransitionEntry entry : sfcFile.transitions) {
                transitions.add(new Transition(entry.src, entry.tgt, Guard.of(entry.guard)));
            }
        }

        return Sfc.builder()
                .steps(steps)
                .transitions(transitions)
                .variables(sfcFile.variables)
                .initialStep(sfcFile.initialStep)
                .build();
    }

    /**
     * Converts the immutable model back into its file representation.
     */
    public static SfcFile toSfcFile(Sfc sfc) {
        SfcFile sfcFile = new SfcFile();
        sfcFile.steps = new ArrayList<>();
        for (Step step : sfc.steps()) {
            StepEntry entry = new StepEntry();
            entry.name = step.name();
            entry.function = step.function();
            sfcFile.steps.add(entry);
        }
        sfcFile.transitions = new ArrayList<>();
        for (Transition transition : sfc.transitions()) {
            TransitionEntry entry = new TransitionEntry();
            entry.src = new ArrayList<>(transition.src());
            entry.tgt = new ArrayList<>(transition.tgt());
            entry.guard = transition.guard().text();
            sfcFile.transitions.add(entry);
        }
        sfcFile.variables = new ArrayList<>(sfc.variables());
        sfcFile.initialStep = sfc.initialStep();
        return sfcFile;
    }

    /**
     * Writes the model as pretty-printed JSON.
     *
     * @param sfc            the model
     * @param outputFilePath target file, parent directories must exist
     */
    public static void save(Sfc sfc, String outputFilePath) throws IOException {
        mapper.writer(SerializationFeature.INDENT_OUTPUT)
                .writeValue(new File(outputFilePath), toSfcFile(sfc));
    }
}
