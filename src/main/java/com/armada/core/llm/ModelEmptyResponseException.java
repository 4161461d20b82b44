package com.armada.core.llm;

/**
 * Thrown when the model returns null or blank content instead of a valid response.
 */
public class ModelEmptyResponseException extends RuntimeException {

    public ModelEmptyResponseException(String message) {
        super(message);
    }
}
