package com.example.flowerclassifier.service.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the model from a file on the local file system.
 */
public class LocalModelAcquisitionStrategy implements ModelAcquisitionStrategy {

    private static final Logger log = LoggerFactory.getLogger(LocalModelAcquisitionStrategy.class);

    private final String name;
    private final Path modelPath;
    private final DetectionBackendFactory backendFactory;

    public LocalModelAcquisitionStrategy(String name, Path modelPath, DetectionBackendFactory backendFactory) {
        this.name = name;
        this.modelPath = modelPath;
        this.backendFactory = backendFactory;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AcquisitionResult acquire() {
        if (!Files.isRegularFile(modelPath)) {
            return AcquisitionResult.failure("model file " + modelPath.toAbsolutePath() + " not found");
        }
        byte[] modelBytes;
        try {
            modelBytes = Files.readAllBytes(modelPath);
        } catch (IOException ex) {
            return AcquisitionResult.failure("unable to read " + modelPath.toAbsolutePath() + ": " + ex.getMessage());
        }
        log.info("Loading detection model from {}", modelPath.toAbsolutePath());
        return AcquisitionResult.load(backendFactory, modelBytes, modelPath.toAbsolutePath().toString());
    }
}
