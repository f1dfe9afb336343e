package org.sfc.verification.sfc;

import java.util.List;

/**
 * Raised when an SFC model file cannot be read, does not match the model schema,
 * or fails strict structural validation.
 */
public class SfcModelException extends RuntimeException {

    private final List<String> problems;

    public SfcModelException(String message) {
        super(message);
        this.problems = List.of();
    }

    public SfcModelException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of();
    }

    public SfcModelException(String message, List<String> problems) {
        super(message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * @return the individual validation problems, empty when the failure was not a validation failure
     */
    public List<String> getProblems() {
        return problems;
    }
}
