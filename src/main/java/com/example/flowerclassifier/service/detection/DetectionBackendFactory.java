package com.example.flowerclassifier.service.detection;

@FunctionalInterface
public interface DetectionBackendFactory {

    /**
     * @throws IllegalStateException when the model artifact cannot be loaded
     */
    DetectionBackend create(byte[] modelBytes);
}
