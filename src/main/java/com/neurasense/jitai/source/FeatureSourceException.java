package com.neurasense.jitai.source;

/**
 * Raised by a feature source adapter when its backing store cannot be read.
 * The context builder turns it into namespace defaults.
 */
public class FeatureSourceException extends RuntimeException {
    public FeatureSourceException(String message) {
        super(message);
    }

    public FeatureSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
