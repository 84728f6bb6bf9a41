package com.example.flowerclassifier.service.detection;

import java.util.Objects;

/**
 * Outcome of one model acquisition strategy: either a ready backend or the
 * reason the strategy could not provide one.
 */
public record AcquisitionResult(DetectionBackend backend, String failureReason) {

    public static AcquisitionResult success(DetectionBackend backend) {
        return new AcquisitionResult(Objects.requireNonNull(backend, "backend"), null);
    }

    public static AcquisitionResult failure(String reason) {
        return new AcquisitionResult(null, Objects.requireNonNull(reason, "reason"));
    }

    /**
     * Turns a model artifact into a backend, reporting load errors as a failed
     * result.
     */
    static AcquisitionResult load(DetectionBackendFactory factory, byte[] modelBytes, String origin) {
        try {
            return success(factory.create(modelBytes));
        } catch (IllegalStateException ex) {
            return failure("model from " + origin + " could not be loaded: " + ex.getMessage());
        }
    }

    public boolean succeeded() {
        return backend != null;
    }
}
