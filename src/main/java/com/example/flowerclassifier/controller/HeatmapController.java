package com.example.flowerclassifier.controller;

import com.example.flowerclassifier.model.response.HeatmapResponse;
import com.example.flowerclassifier.service.HeatmapService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Heatmap", description = "Aggregated classification data for map visualization")
public class HeatmapController {

    private final HeatmapService heatmapService;

    public HeatmapController(HeatmapService heatmapService) {
        this.heatmapService = heatmapService;
    }

    @Operation(
            summary = "Get geotagged classifications for the heatmap",
            description = "Returns every classification that has a location. total_records counts all stored classifications.")
    @GetMapping("/heatmap-data")
    public ResponseEntity<HeatmapResponse> heatmapData() {
        return ResponseEntity.ok(heatmapService.buildHeatmap());
    }
}
