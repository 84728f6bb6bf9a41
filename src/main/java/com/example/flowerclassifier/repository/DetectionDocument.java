package com.example.flowerclassifier.repository;

import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;

public class DetectionDocument {

    @Field("bounding_box")
    private List<Double> boundingBox;

    private int stage;

    private double confidence;

    public DetectionDocument() {
    }

    public DetectionDocument(List<Double> boundingBox, int stage, double confidence) {
        this.boundingBox = boundingBox;
        this.stage = stage;
        this.confidence = confidence;
    }

    public List<Double> getBoundingBox() {
        return boundingBox;
    }

    public void setBoundingBox(List<Double> boundingBox) {
        this.boundingBox = boundingBox;
    }

    public int getStage() {
        return stage;
    }

    public void setStage(int stage) {
        this.stage = stage;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }
}
