package com.example.flowerclassifier.model.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "All geotagged classifications for the heatmap view")
public record HeatmapResponse(
        @JsonProperty("total_records")
        @Schema(description = "Number of stored classifications, including those without a location")
        int totalRecords,
        @JsonProperty("data_points") List<HeatmapDataPoint> dataPoints) {
}
