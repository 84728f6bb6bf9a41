package com.example.flowerclassifier.model.response;

import com.example.flowerclassifier.model.Detection;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "A single flower detection with its growth stage")
public record DetectionResponse(
        @JsonProperty("bounding_box")
        @Schema(description = "Bounding box as [x_min, y_min, x_max, y_max] in pixels", example = "[120.0, 48.5, 210.0, 131.0]")
        List<Double> boundingBox,
        @Schema(description = "Flower stage: 0=bud, 1=anthesis, 2=post-anthesis", example = "1") int stage,
        @Schema(description = "Model confidence score", example = "0.87") double confidence) {

    public static DetectionResponse from(Detection detection) {
        return new DetectionResponse(
                detection.boundingBox().toList(),
                detection.stage().index(),
                detection.confidence());
    }
}
