package com.example.flowerclassifier.service.detection;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * A loaded object-detection model. Implementations are shared by all
 * requests once acquired and must be safe for concurrent use.
 */
public interface DetectionBackend extends AutoCloseable {

    /**
     * @param rgbImage      three-channel RGB image
     * @param minConfidence candidates scoring below this value may be pruned
     *                      before non-maximum suppression
     * @return detections in source-image pixel coordinates, possibly empty
     * @throws InferenceException when the model fails to run
     */
    List<RawDetection> infer(BufferedImage rgbImage, double minConfidence);

    @Override
    void close();
}
