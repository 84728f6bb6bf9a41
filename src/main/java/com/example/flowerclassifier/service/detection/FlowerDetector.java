package com.example.flowerclassifier.service.detection;

import com.example.flowerclassifier.exception.ModelUnavailableException;
import com.example.flowerclassifier.model.BoundingBox;
import com.example.flowerclassifier.model.Detection;
import com.example.flowerclassifier.model.Stage;
import com.example.flowerclassifier.util.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the shared detection backend over an image and turns its raw output
 * into domain detections.
 */
@Component
public class FlowerDetector {

    private static final Logger log = LoggerFactory.getLogger(FlowerDetector.class);

    private final DetectionModelLoader modelLoader;

    public FlowerDetector(DetectionModelLoader modelLoader) {
        this.modelLoader = modelLoader;
    }

    /**
     * @param confidenceThreshold detections scoring below this value are dropped
     * @return detections in backend order, empty when nothing qualifies
     * @throws ModelUnavailableException when the model cannot be acquired or
     *                                   inference fails
     * @throws IllegalStateException     when the model reports a class that is
     *                                   not a known flower stage
     */
    public List<Detection> detect(BufferedImage image, double confidenceThreshold) {
        Objects.requireNonNull(image, "BufferedImage must not be null");
        if (!(confidenceThreshold >= 0.0 && confidenceThreshold <= 1.0)) {
            throw new IllegalArgumentException("Confidence threshold must be within [0, 1]");
        }
        DetectionBackend backend = modelLoader.acquire();
        BufferedImage rgb = ImagePreprocessor.toRgb(image);

        long start = System.nanoTime();
        List<RawDetection> raw;
        try {
            raw = backend.infer(rgb, confidenceThreshold);
        } catch (InferenceException ex) {
            throw new ModelUnavailableException("Flower detection failed: " + ex.getMessage(), ex);
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        List<Detection> detections = new ArrayList<>(raw.size());
        for (RawDetection candidate : raw) {
            if (candidate.confidence() < confidenceThreshold) {
                continue;
            }
            detections.add(toDetection(candidate));
        }
        log.debug("Detected {} flowers ({} candidates) in {} ms", detections.size(), raw.size(), elapsedMs);
        return detections;
    }

    private Detection toDetection(RawDetection candidate) {
        Stage stage;
        try {
            stage = Stage.fromIndex(candidate.classIndex());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Detection model produced unknown stage index " + candidate.classIndex(), ex);
        }
        try {
            BoundingBox box = new BoundingBox(candidate.xMin(), candidate.yMin(), candidate.xMax(), candidate.yMax());
            return new Detection(box, stage, candidate.confidence());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Detection model produced an invalid detection: " + ex.getMessage(), ex);
        }
    }
}
