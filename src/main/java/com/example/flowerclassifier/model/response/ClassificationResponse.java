package com.example.flowerclassifier.model.response;

import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.Stage;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Schema(description = "Stored classification result for one uploaded image")
public record ClassificationResponse(
        @Schema(description = "Record identifier", example = "5b1f2c7e-8d7a-4a44-9f0b-0c1f5e7f6a10") String id,
        @JsonProperty("image_path")
        @Schema(description = "API path serving the stored image", example = "/api/images/5b1f2c7e-8d7a-4a44-9f0b-0c1f5e7f6a10")
        String imagePath,
        @Schema(description = "Location the picture was taken at, null when unknown", nullable = true)
        LocationResponse location,
        @Schema(description = "Creation time (UTC)") Instant timestamp,
        @Schema(description = "Detected flowers") List<DetectionResponse> flowers,
        @JsonProperty("flower_count") @Schema(example = "3") int flowerCount,
        @JsonProperty("stage_summary")
        @Schema(description = "Number of flowers per stage, keyed by stage index", example = "{\"0\": 2, \"1\": 1}")
        Map<String, Integer> stageSummary) {

    public static ClassificationResponse from(ClassificationRecord record) {
        return new ClassificationResponse(
                record.id(),
                imagePath(record.id()),
                LocationResponse.from(record.location()),
                record.timestamp(),
                toDetectionResponses(record),
                record.flowerCount(),
                toWireSummary(record.stageSummary()));
    }

    public static String imagePath(String id) {
        return "/api/images/" + id;
    }

    static List<DetectionResponse> toDetectionResponses(ClassificationRecord record) {
        return record.detections().stream()
                .map(DetectionResponse::from)
                .collect(Collectors.toList());
    }

    static Map<String, Integer> toWireSummary(Map<Stage, Integer> summary) {
        Map<String, Integer> wire = new LinkedHashMap<>();
        summary.forEach((stage, count) -> wire.put(String.valueOf(stage.index()), count));
        return wire;
    }
}
