package com.example.flowerclassifier.service.detection;

import com.example.flowerclassifier.util.ImagePreprocessor.Letterbox;

import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decodes the output tensor of an Ultralytics YOLOv8 ONNX export.
 * <p>
 * The tensor has shape {@code [1, 4 + classes, boxes]} (channels first) or
 * {@code [1, boxes, 4 + classes]}. Each box holds {@code cx, cy, w, h}
 * relative to the letterboxed input followed by one score per class; there
 * is no separate objectness score.
 */
final class YoloOutputDecoder {

    private static final int BOX_FEATURES = 4;

    private final double nmsThreshold;

    YoloOutputDecoder(double nmsThreshold) {
        this.nmsThreshold = nmsThreshold;
    }

    List<RawDetection> decode(FloatBuffer raw, long[] shape, Letterbox letterbox,
                              int imageWidth, int imageHeight, double minConfidence) {
        if (shape.length != 3) {
            throw new InferenceException("Unexpected YOLO output rank " + shape.length);
        }
        boolean channelFirst = shape[1] < shape[2];
        int numFeatures = (int) (channelFirst ? shape[1] : shape[2]);
        int numBoxes = (int) (channelFirst ? shape[2] : shape[1]);
        if (numFeatures <= BOX_FEATURES) {
            throw new InferenceException("YOLO output carries no class scores");
        }

        List<RawDetection> candidates = new ArrayList<>();
        for (int i = 0; i < numBoxes; i++) {
            int bestClass = -1;
            float bestScore = 0f;
            for (int c = BOX_FEATURES; c < numFeatures; c++) {
                float score = value(raw, i, c, numBoxes, numFeatures, channelFirst);
                if (score > bestScore) {
                    bestScore = score;
                    bestClass = c - BOX_FEATURES;
                }
            }
            if (bestClass < 0 || bestScore < minConfidence) {
                continue;
            }

            float cx = value(raw, i, 0, numBoxes, numFeatures, channelFirst);
            float cy = value(raw, i, 1, numBoxes, numFeatures, channelFirst);
            float w = value(raw, i, 2, numBoxes, numFeatures, channelFirst);
            float h = value(raw, i, 3, numBoxes, numFeatures, channelFirst);

            double x1 = clamp(letterbox.toSourceX(cx - w / 2.0), imageWidth);
            double y1 = clamp(letterbox.toSourceY(cy - h / 2.0), imageHeight);
            double x2 = clamp(letterbox.toSourceX(cx + w / 2.0), imageWidth);
            double y2 = clamp(letterbox.toSourceY(cy + h / 2.0), imageHeight);
            if (x2 <= x1 || y2 <= y1) {
                continue;
            }
            candidates.add(new RawDetection(x1, y1, x2, y2, bestClass, Math.min(1.0, bestScore)));
        }
        return nonMaxSuppression(candidates);
    }

    /**
     * Class-agnostic: a flower is in exactly one stage, so overlapping boxes
     * of different stages compete with each other.
     */
    List<RawDetection> nonMaxSuppression(List<RawDetection> detections) {
        List<RawDetection> ordered = new ArrayList<>(detections);
        ordered.sort(Comparator.comparingDouble(RawDetection::confidence).reversed());
        List<RawDetection> kept = new ArrayList<>();
        for (RawDetection candidate : ordered) {
            boolean suppressed = false;
            for (RawDetection selected : kept) {
                if (intersectionOverUnion(candidate, selected) > nmsThreshold) {
                    suppressed = true;
                    break;
                }
            }
            if (!suppressed) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    static double intersectionOverUnion(RawDetection a, RawDetection b) {
        double x1 = Math.max(a.xMin(), b.xMin());
        double y1 = Math.max(a.yMin(), b.yMin());
        double x2 = Math.min(a.xMax(), b.xMax());
        double y2 = Math.min(a.yMax(), b.yMax());
        double intersection = Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
        double union = a.area() + b.area() - intersection;
        if (union <= 0) {
            return 0d;
        }
        return intersection / union;
    }

    private static float value(FloatBuffer buffer, int box, int feature, int numBoxes, int numFeatures,
                               boolean channelFirst) {
        if (channelFirst) {
            return buffer.get(feature * numBoxes + box);
        }
        return buffer.get(box * numFeatures + feature);
    }

    private static double clamp(double value, int max) {
        return Math.max(0, Math.min(max, value));
    }
}
