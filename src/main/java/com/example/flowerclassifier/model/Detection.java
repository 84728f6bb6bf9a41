package com.example.flowerclassifier.model;

import java.util.Objects;

public record Detection(BoundingBox boundingBox, Stage stage, double confidence) {

    public Detection {
        Objects.requireNonNull(boundingBox, "boundingBox");
        Objects.requireNonNull(stage, "stage");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Detection confidence must be within [0, 1] but was " + confidence);
        }
    }
}
