package com.example.flowerclassifier.service.detection;

public enum ModelStatus {
    NOT_LOADED,
    LOADING,
    READY,
    UNAVAILABLE
}
