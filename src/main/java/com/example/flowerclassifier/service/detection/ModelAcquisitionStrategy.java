package com.example.flowerclassifier.service.detection;

/**
 * One way of obtaining the detection model. Strategies report failure through
 * {@link AcquisitionResult} instead of throwing.
 */
public interface ModelAcquisitionStrategy {

    String name();

    AcquisitionResult acquire();
}
