package com.example.flowerclassifier.exception;

import java.util.List;

/**
 * The detection model could not be acquired, or inference on it failed.
 * Carries the failure reason of every acquisition strategy that was tried.
 */
public class ModelUnavailableException extends RuntimeException {

    private final List<String> reasons;

    public ModelUnavailableException(String message) {
        this(message, List.of(), null);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ModelUnavailableException(String message, List<String> reasons) {
        this(message, reasons, null);
    }

    private ModelUnavailableException(String message, List<String> reasons, Throwable cause) {
        super(reasons.isEmpty() ? message : message + ": " + String.join("; ", reasons), cause);
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
