package com.example.flowerclassifier.controller;

import com.example.flowerclassifier.exception.InvalidInputException;
import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.ImageUpload;
import com.example.flowerclassifier.model.response.ClassificationResponse;
import com.example.flowerclassifier.model.response.DeletionResponse;
import com.example.flowerclassifier.service.AnnotatedImageRenderer;
import com.example.flowerclassifier.service.ClassificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api")
@Tag(name = "Classification", description = "Upload tomato plant images and manage stored classifications")
public class ClassificationController {

    private static final Logger log = LoggerFactory.getLogger(ClassificationController.class);

    private final ClassificationService service;
    private final AnnotatedImageRenderer renderer;

    public ClassificationController(ClassificationService service, AnnotatedImageRenderer renderer) {
        this.service = service;
        this.renderer = renderer;
    }

    @Operation(
            summary = "Classify the flowers in an uploaded image",
            description = "Extracts the GPS location from EXIF data unless latitude and longitude are supplied, "
                    + "detects flowers, classifies their stage (0=bud, 1=anthesis, 2=post-anthesis) and stores the result.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Image classified and stored",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ClassificationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Not an image or invalid coordinates", content = @Content),
            @ApiResponse(responseCode = "503", description = "Model or database unavailable", content = @Content)
    })
    @PostMapping(value = "/classify", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ClassificationResponse> classify(
            @Parameter(description = "Image file of a tomato plant", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Manual latitude override") @RequestParam(value = "latitude", required = false) Double latitude,
            @Parameter(description = "Manual longitude override") @RequestParam(value = "longitude", required = false) Double longitude,
            @Parameter(description = "Minimum confidence for a detection to be kept")
            @RequestParam(value = "confidence_threshold", required = false) Double confidenceThreshold) {
        ClassificationRecord record = service.classify(toUpload(file), latitude, longitude, confidenceThreshold);
        return ResponseEntity.ok(ClassificationResponse.from(record));
    }

    @Operation(summary = "Get a stored classification")
    @GetMapping("/classifications/{id}")
    public ResponseEntity<ClassificationResponse> getClassification(@PathVariable("id") String id) {
        return ResponseEntity.ok(ClassificationResponse.from(service.get(id)));
    }

    @Operation(summary = "Delete a classification and its image")
    @DeleteMapping("/classifications/{id}")
    public ResponseEntity<DeletionResponse> deleteClassification(@PathVariable("id") String id) {
        service.delete(id);
        return ResponseEntity.ok(new DeletionResponse("Classification deleted successfully", id));
    }

    @Operation(summary = "Get the originally uploaded image")
    @GetMapping("/images/{id}")
    public ResponseEntity<byte[]> getImage(@PathVariable("id") String id) {
        ClassificationRecord record = service.get(id);
        return ResponseEntity.ok()
                .contentType(storedMediaType(record))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.inline().filename(record.imageFilename()).build().toString())
                .body(record.image());
    }

    @Operation(summary = "Get the image with detection boxes and stage labels drawn on it")
    @GetMapping("/images/{id}/annotated")
    public ResponseEntity<byte[]> getAnnotatedImage(@PathVariable("id") String id) {
        byte[] png = renderer.render(service.get(id));
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .body(png);
    }

    private static MediaType storedMediaType(ClassificationRecord record) {
        try {
            return MediaType.parseMediaType(record.imageContentType());
        } catch (InvalidMediaTypeException ex) {
            log.warn("Record {} has unparseable content type '{}', serving as octet-stream", record.id(), record.imageContentType());
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private ImageUpload toUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("Image file is required");
        }
        try {
            return new ImageUpload(file.getBytes(), file.getContentType(), file.getOriginalFilename());
        } catch (IOException ex) {
            throw new InvalidInputException("Failed to read uploaded image", ex);
        }
    }
}
