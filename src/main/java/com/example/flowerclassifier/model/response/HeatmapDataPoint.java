package com.example.flowerclassifier.model.response;

import com.example.flowerclassifier.model.ClassificationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Schema(description = "Geotagged classification reshaped for map rendering")
public record HeatmapDataPoint(
        String id,
        double latitude,
        double longitude,
        Instant timestamp,
        List<DetectionResponse> flowers,
        @JsonProperty("total_flowers") int totalFlowers,
        @JsonProperty("stage_counts")
        @Schema(description = "Number of flowers per stage, keyed by stage index")
        Map<String, Integer> stageCounts) {

    /**
     * @throws IllegalArgumentException if the record carries no location
     */
    public static HeatmapDataPoint from(ClassificationRecord record) {
        if (!record.hasLocation()) {
            throw new IllegalArgumentException("Record " + record.id() + " has no location");
        }
        return new HeatmapDataPoint(
                record.id(),
                record.location().latitude(),
                record.location().longitude(),
                record.timestamp(),
                ClassificationResponse.toDetectionResponses(record),
                record.flowerCount(),
                ClassificationResponse.toWireSummary(record.stageSummary()));
    }
}
