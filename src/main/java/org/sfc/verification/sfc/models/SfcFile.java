package org.sfc.verification.sfc.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root structure of an SFC model file.
 * <p>
 * Example:
 * <pre>
 * {
 *   "steps": [{"name": "Start", "function": "i := 1; fact := 1"}, ...],
 *   "transitions": [{"src": "Start", "tgt": "Check", "guard": "init"}, ...],
 *   "variables": ["i", "fact", "n"],
 *   "initialStep": "Start"
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SfcFile {
    public List<StepEntry> steps;
    public List<TransitionEntry> transitions;
    public List<String> variables;

    /**
     * Name of the step holding the initial token.
     */
    public String initialStep;
}
