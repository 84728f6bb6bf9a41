package com.example.flowerclassifier.service.detection;

/**
 * Detection as produced by the backend, before the class index is mapped
 * onto a flower stage.
 */
public record RawDetection(double xMin, double yMin, double xMax, double yMax, int classIndex, double confidence) {

    public double area() {
        return Math.max(0, xMax - xMin) * Math.max(0, yMax - yMin);
    }
}
