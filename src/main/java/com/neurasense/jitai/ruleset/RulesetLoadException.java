package com.neurasense.jitai.ruleset;

/**
 * The rule document as a whole could not be read or parsed.
 * Individual malformed rules never raise this; they are skipped.
 */
public class RulesetLoadException extends RuntimeException {
    public RulesetLoadException(String message) {
        super(message);
    }

    public RulesetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
