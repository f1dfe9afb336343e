package org.sfc.verification.sfc.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A step as written in a model file.
 * Example: {"name": "Multiply", "function": "fact := fact * i"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StepEntry {
    public String name;

    /**
     * Entry assignments separated by ';'. Empty for steps without actions.
     */
    public String function;
}
