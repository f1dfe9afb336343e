package org.sfc.verification.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Options of a containment run.
 * <p>
 * Example config.json:
 * <pre>
 * {
 *   "dataComparison": "SYNTACTIC",
 *   "solverTimeoutMillis": 5000,
 *   "parallelMatching": false,
 *   "strictModelValidation": false,
 *   "reportFormats": ["json", "html"]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerifierConfig {
    public DataComparison dataComparison = DataComparison.SYNTACTIC;

    /**
     * Per-query solver timeout, 0 for none. A timed out query counts as not equivalent.
     */
    public int solverTimeoutMillis = 0;

    /**
     * Match the paths of model 1 on a parallel stream.
     */
    public boolean parallelMatching = false;

    /**
     * Reject models with undeclared step references instead of logging them.
     */
    public boolean strictModelValidation = false;

    /**
     * Reports written by the command line: "json", "html", "dot".
     */
    public List<String> reportFormats = new ArrayList<>(List.of("json"));

    public static VerifierConfig defaults() {
        return new VerifierConfig();
    }
}
