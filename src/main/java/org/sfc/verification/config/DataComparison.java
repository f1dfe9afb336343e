package org.sfc.verification.config;

/**
 * How the data transformations of two paths are compared.
 */
public enum DataComparison {
    /**
     * Right-hand sides must be the identical prefix text.
     */
    SYNTACTIC,
    /**
     * Right-hand sides must be provably equal over the integers; a missing fact means the variable is unchanged.
     */
    SEMANTIC
}
