package com.example.flowerclassifier.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of classifying one uploaded image. Instances are only created by
 * {@link com.example.flowerclassifier.service.ClassificationRecordBuilder} or
 * when reading back from the store, and are never modified afterwards.
 *
 * @param location {@code null} when the image carried no usable GPS data and
 *                 no manual coordinates were supplied
 */
public record ClassificationRecord(
        String id,
        byte[] image,
        String imageContentType,
        String imageFilename,
        GeoLocation location,
        Instant timestamp,
        List<Detection> detections,
        int flowerCount,
        Map<Stage, Integer> stageSummary) {

    public ClassificationRecord {
        Objects.requireNonNull(id, "id");
        image = Objects.requireNonNull(image, "image").clone();
        Objects.requireNonNull(timestamp, "timestamp");
        detections = List.copyOf(detections);
        EnumMap<Stage, Integer> summary = new EnumMap<>(Stage.class);
        summary.putAll(stageSummary);
        stageSummary = Collections.unmodifiableMap(summary);
    }

    @Override
    public byte[] image() {
        return image.clone();
    }

    public boolean hasLocation() {
        return location != null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ClassificationRecord that)) {
            return false;
        }
        return flowerCount == that.flowerCount
                && id.equals(that.id)
                && Arrays.equals(image, that.image)
                && Objects.equals(imageContentType, that.imageContentType)
                && Objects.equals(imageFilename, that.imageFilename)
                && Objects.equals(location, that.location)
                && timestamp.equals(that.timestamp)
                && detections.equals(that.detections)
                && stageSummary.equals(that.stageSummary);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, imageContentType, imageFilename, location, timestamp, detections,
                flowerCount, stageSummary);
        return 31 * result + Arrays.hashCode(image);
    }

    @Override
    public String toString() {
        return "ClassificationRecord[id=" + id
                + ", image=" + image.length + " bytes"
                + ", imageContentType=" + imageContentType
                + ", imageFilename=" + imageFilename
                + ", location=" + location
                + ", timestamp=" + timestamp
                + ", flowerCount=" + flowerCount
                + ", stageSummary=" + stageSummary + "]";
    }

    public static Map<Stage, Integer> summarize(List<Detection> detections) {
        EnumMap<Stage, Integer> summary = new EnumMap<>(Stage.class);
        for (Detection detection : detections) {
            summary.merge(detection.stage(), 1, Integer::sum);
        }
        return summary;
    }
}
