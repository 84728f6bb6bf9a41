package com.example.flowerclassifier.repository;

import com.example.flowerclassifier.model.BoundingBox;
import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.Detection;
import com.example.flowerclassifier.model.GeoLocation;
import com.example.flowerclassifier.model.Stage;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stored form of a {@link ClassificationRecord}. The image travels as a
 * Base64 string next to the structured fields.
 */
@Document(collection = ClassificationDocument.COLLECTION)
public class ClassificationDocument {

    public static final String COLLECTION = "classifications";

    @Id
    private String id;

    @Field("image_base64")
    private String imageBase64;

    @Field("image_filename")
    private String imageFilename;

    @Field("image_content_type")
    private String imageContentType;

    private Double latitude;

    private Double longitude;

    private Instant timestamp;

    private List<DetectionDocument> flowers = new ArrayList<>();

    public ClassificationDocument() {
    }

    public static ClassificationDocument fromRecord(ClassificationRecord record) {
        ClassificationDocument document = new ClassificationDocument();
        document.id = record.id();
        document.imageBase64 = Base64.getEncoder().encodeToString(record.image());
        document.imageFilename = record.imageFilename();
        document.imageContentType = record.imageContentType();
        if (record.hasLocation()) {
            document.latitude = record.location().latitude();
            document.longitude = record.location().longitude();
        }
        document.timestamp = record.timestamp();
        document.flowers = record.detections().stream()
                .map(detection -> new DetectionDocument(
                        detection.boundingBox().toList(),
                        detection.stage().index(),
                        detection.confidence()))
                .collect(Collectors.toList());
        return document;
    }

    /**
     * @throws IllegalStateException when the stored document is corrupt
     */
    public ClassificationRecord toRecord() {
        try {
            byte[] image = Base64.getDecoder().decode(imageBase64 != null ? imageBase64 : "");
            GeoLocation location = latitude != null && longitude != null ? new GeoLocation(latitude, longitude) : null;
            List<Detection> detections = new ArrayList<>();
            if (flowers != null) {
                for (DetectionDocument flower : flowers) {
                    detections.add(new Detection(
                            BoundingBox.fromList(flower.getBoundingBox()),
                            Stage.fromIndex(flower.getStage()),
                            flower.getConfidence()));
                }
            }
            return new ClassificationRecord(
                    id,
                    image,
                    imageContentType,
                    imageFilename,
                    location,
                    timestamp,
                    detections,
                    detections.size(),
                    ClassificationRecord.summarize(detections));
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new IllegalStateException("Stored classification " + id + " is corrupt: " + ex.getMessage(), ex);
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getImageBase64() {
        return imageBase64;
    }

    public void setImageBase64(String imageBase64) {
        this.imageBase64 = imageBase64;
    }

    public String getImageFilename() {
        return imageFilename;
    }

    public void setImageFilename(String imageFilename) {
        this.imageFilename = imageFilename;
    }

    public String getImageContentType() {
        return imageContentType;
    }

    public void setImageContentType(String imageContentType) {
        this.imageContentType = imageContentType;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public List<DetectionDocument> getFlowers() {
        return flowers;
    }

    public void setFlowers(List<DetectionDocument> flowers) {
        this.flowers = flowers;
    }
}
