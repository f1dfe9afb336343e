package org.sfc.verification.expression;

/**
 * Raised for prefix expression text that is not a single balanced term.
 */
public class PrefixSyntaxException extends IllegalArgumentException {
    public PrefixSyntaxException(String message) {
        super(message);
    }
}
