package com.tyron.picedit.core.rules;

/**
 * Thrown when a highlight or indentation rule table is invalid. Raised while the table is
 * built or loaded, never while it is evaluated.
 */
public class RuleTableException extends RuntimeException {

    public RuleTableException(String message) {
        super(message);
    }

    public RuleTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
