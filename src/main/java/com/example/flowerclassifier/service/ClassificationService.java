package com.example.flowerclassifier.service;

import com.example.flowerclassifier.config.ClassifierProperties;
import com.example.flowerclassifier.exception.ClassificationNotFoundException;
import com.example.flowerclassifier.exception.InvalidInputException;
import com.example.flowerclassifier.exception.ModelUnavailableException;
import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.Detection;
import com.example.flowerclassifier.model.GeoLocation;
import com.example.flowerclassifier.model.ImageUpload;
import com.example.flowerclassifier.repository.ClassificationRepository;
import com.example.flowerclassifier.service.detection.FlowerDetector;
import com.example.flowerclassifier.service.geo.ExifGeolocationExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Classification pipeline: validate the upload, run location resolution and
 * flower detection side by side, then build and persist the record. Nothing
 * is written unless every step succeeded.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);
    private static final String NOT_AN_IMAGE = "File must be an image (JPEG, PNG, etc.)";

    private final FlowerDetector detector;
    private final ExifGeolocationExtractor geolocationExtractor;
    private final ClassificationRecordBuilder recordBuilder;
    private final ClassificationRepository repository;
    private final ClassifierProperties properties;
    private final Executor inferenceExecutor;

    public ClassificationService(FlowerDetector detector,
                                 ExifGeolocationExtractor geolocationExtractor,
                                 ClassificationRecordBuilder recordBuilder,
                                 ClassificationRepository repository,
                                 ClassifierProperties properties,
                                 @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
        this.detector = detector;
        this.geolocationExtractor = geolocationExtractor;
        this.recordBuilder = recordBuilder;
        this.repository = repository;
        this.properties = properties;
        this.inferenceExecutor = inferenceExecutor;
    }

    /**
     * @param latitude            manual latitude, supplied together with {@code longitude} or not at all
     * @param confidenceThreshold per-request threshold, {@code null} for the configured default
     */
    public ClassificationRecord classify(ImageUpload upload, Double latitude, Double longitude, Double confidenceThreshold) {
        GeoLocation manualLocation = resolveManualLocation(latitude, longitude);
        double threshold = resolveThreshold(confidenceThreshold);
        ImageUpload validated = withValidatedContentType(upload);
        BufferedImage image = decode(validated);

        CompletableFuture<List<Detection>> inference;
        try {
            inference = CompletableFuture.supplyAsync(() -> detector.detect(image, threshold), inferenceExecutor);
        } catch (RejectedExecutionException ex) {
            throw new ModelUnavailableException("Inference capacity exhausted, retry later", ex);
        }

        GeoLocation location = manualLocation != null
                ? manualLocation
                : geolocationExtractor.extract(validated.content()).orElse(null);

        List<Detection> detections = awaitInference(inference);
        ClassificationRecord record = recordBuilder.build(validated, location, detections);
        repository.insert(record);
        log.info("Stored classification {} with {} flowers (location: {}, threshold: {})",
                record.id(), record.flowerCount(), location != null ? "known" : "unknown", threshold);
        return record;
    }

    public ClassificationRecord get(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new ClassificationNotFoundException(id));
    }

    public void delete(String id) {
        if (!repository.deleteById(id)) {
            throw new ClassificationNotFoundException(id);
        }
        log.info("Deleted classification {}", id);
    }

    GeoLocation resolveManualLocation(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return null;
        }
        if (latitude == null || longitude == null) {
            throw new InvalidInputException("latitude and longitude must be provided together");
        }
        if (!GeoLocation.isValid(latitude, longitude)) {
            throw new InvalidInputException("latitude must be within [-90, 90] and longitude within [-180, 180]");
        }
        return new GeoLocation(latitude, longitude);
    }

    double resolveThreshold(Double confidenceThreshold) {
        if (confidenceThreshold == null) {
            return properties.getConfidenceThreshold();
        }
        if (!(confidenceThreshold >= 0.0 && confidenceThreshold <= 1.0)) {
            throw new InvalidInputException("confidence_threshold must be within [0, 1]");
        }
        return confidenceThreshold;
    }

    /**
     * The stored content type is served back verbatim, so it must parse as a
     * concrete {@code image/*} media type. Returns the upload with the
     * normalized type.
     */
    ImageUpload withValidatedContentType(ImageUpload upload) {
        if (upload == null || upload.isEmpty()) {
            throw new InvalidInputException("Image file is required");
        }
        String contentType = upload.contentType();
        if (contentType == null) {
            throw new InvalidInputException(NOT_AN_IMAGE);
        }
        MediaType mediaType;
        try {
            mediaType = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException ex) {
            throw new InvalidInputException(NOT_AN_IMAGE, ex);
        }
        if (!"image".equals(mediaType.getType()) || mediaType.isWildcardSubtype()) {
            throw new InvalidInputException(NOT_AN_IMAGE);
        }
        return new ImageUpload(upload.content(), mediaType.toString(), upload.originalFilename());
    }

    private BufferedImage decode(ImageUpload upload) {
        try (ByteArrayInputStream input = new ByteArrayInputStream(upload.content())) {
            BufferedImage image = ImageIO.read(input);
            if (image == null) {
                throw new InvalidInputException("Unable to decode provided image");
            }
            return image;
        } catch (IOException ex) {
            throw new InvalidInputException("Failed to read uploaded image", ex);
        }
    }

    private List<Detection> awaitInference(CompletableFuture<List<Detection>> inference) {
        try {
            return inference.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Flower detection failed", cause);
        }
    }
}
