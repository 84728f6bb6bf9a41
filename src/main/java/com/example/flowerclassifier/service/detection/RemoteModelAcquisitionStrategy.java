package com.example.flowerclassifier.service.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Downloads the model artifact over HTTP and keeps a copy in the cache
 * directory so later restarts can fall back to it without network access.
 */
public class RemoteModelAcquisitionStrategy implements ModelAcquisitionStrategy {

    private static final Logger log = LoggerFactory.getLogger(RemoteModelAcquisitionStrategy.class);

    private final RestTemplate restTemplate;
    private final String modelUrl;
    private final Path cacheFile;
    private final DetectionBackendFactory backendFactory;

    public RemoteModelAcquisitionStrategy(RestTemplate restTemplate, String modelUrl, Path cacheFile,
                                          DetectionBackendFactory backendFactory) {
        this.restTemplate = restTemplate;
        this.modelUrl = modelUrl;
        this.cacheFile = cacheFile;
        this.backendFactory = backendFactory;
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public AcquisitionResult acquire() {
        log.info("Downloading detection model from {}", modelUrl);
        byte[] modelBytes;
        try {
            modelBytes = restTemplate.getForObject(modelUrl, byte[].class);
        } catch (RestClientException ex) {
            return AcquisitionResult.failure("download from " + modelUrl + " failed: " + ex.getMessage());
        }
        if (modelBytes == null || modelBytes.length == 0) {
            return AcquisitionResult.failure("download from " + modelUrl + " returned no content");
        }
        AcquisitionResult result = AcquisitionResult.load(backendFactory, modelBytes, modelUrl);
        if (result.succeeded()) {
            writeCache(modelBytes);
        }
        return result;
    }

    private void writeCache(byte[] modelBytes) {
        try {
            Files.createDirectories(cacheFile.toAbsolutePath().getParent());
            Path temp = Files.createTempFile(cacheFile.toAbsolutePath().getParent(), "model", ".part");
            Files.write(temp, modelBytes);
            Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Cached downloaded model at {}", cacheFile.toAbsolutePath());
        } catch (IOException ex) {
            log.warn("Unable to cache downloaded model at {}: {}", cacheFile.toAbsolutePath(), ex.getMessage());
        }
    }
}
