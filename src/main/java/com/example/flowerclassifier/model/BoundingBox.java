package com.example.flowerclassifier.model;

import java.util.List;

/**
 * Axis-aligned rectangle describing a detected flower inside the source
 * image. Coordinates are pixels with the origin in the top-left corner.
 */
public record BoundingBox(double xMin, double yMin, double xMax, double yMax) {

    public BoundingBox {
        if (!(xMin < xMax)) {
            throw new IllegalArgumentException("Bounding box x_min must be smaller than x_max");
        }
        if (!(yMin < yMax)) {
            throw new IllegalArgumentException("Bounding box y_min must be smaller than y_max");
        }
    }

    public double width() {
        return xMax - xMin;
    }

    public double height() {
        return yMax - yMin;
    }

    public List<Double> toList() {
        return List.of(xMin, yMin, xMax, yMax);
    }

    public static BoundingBox fromList(List<Double> coordinates) {
        if (coordinates == null || coordinates.size() != 4) {
            throw new IllegalArgumentException("Bounding box requires exactly four coordinates");
        }
        return new BoundingBox(coordinates.get(0), coordinates.get(1), coordinates.get(2), coordinates.get(3));
    }
}
