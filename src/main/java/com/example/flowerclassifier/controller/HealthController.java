package com.example.flowerclassifier.controller;

import com.example.flowerclassifier.exception.StoreUnavailableException;
import com.example.flowerclassifier.model.response.HealthResponse;
import com.example.flowerclassifier.repository.ClassificationRepository;
import com.example.flowerclassifier.service.detection.DetectionModelLoader;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@Tag(name = "Health")
public class HealthController {

    private final ClassificationRepository repository;
    private final DetectionModelLoader modelLoader;

    public HealthController(ClassificationRepository repository, DetectionModelLoader modelLoader) {
        this.repository = repository;
        this.modelLoader = modelLoader;
    }

    @Operation(summary = "Report API, database and model state")
    @GetMapping("/")
    public ResponseEntity<HealthResponse> health() {
        String database;
        try {
            repository.ping();
            database = "connected";
        } catch (StoreUnavailableException ex) {
            database = "error: " + ex.getMessage();
        }
        HealthResponse.ModelHealth model = new HealthResponse.ModelHealth(
                modelLoader.status().name(), modelLoader.source());
        return ResponseEntity.ok(new HealthResponse("healthy", database, model, Instant.now()));
    }
}
