package com.neurasense.jitai.outcome;

public class RecommendationStoreException extends RuntimeException {
    public RecommendationStoreException(String message) {
        super(message);
    }

    public RecommendationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
