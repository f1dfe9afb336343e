package org.sfc.verification.smt;

/**
 * Raised for a prefix term that has no integer or boolean meaning, such as an unknown operator,
 * a wrong operand count or a symbol used with two sorts.
 */
class Z3TermException extends RuntimeException {
    Z3TermException(String message) {
        super(message);
    }
}
