package com.example.flowerclassifier.service;

import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.Detection;
import com.example.flowerclassifier.model.GeoLocation;
import com.example.flowerclassifier.model.ImageUpload;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Assembles a {@link ClassificationRecord} from already validated inputs.
 * Performs no I/O.
 */
@Component
public class ClassificationRecordBuilder {

    private static final String DEFAULT_EXTENSION = ".jpg";
    private static final String DEFAULT_CONTENT_TYPE = "image/jpeg";

    private final Clock clock;
    private final Supplier<String> idGenerator;

    public ClassificationRecordBuilder() {
        this(Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    ClassificationRecordBuilder(Clock clock, Supplier<String> idGenerator) {
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    /**
     * @param location {@code null} when no location is known
     */
    public ClassificationRecord build(ImageUpload upload, GeoLocation location, List<Detection> detections) {
        String id = idGenerator.get();
        // the store keeps millisecond precision
        Instant timestamp = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        String contentType = upload.contentType() != null ? upload.contentType() : DEFAULT_CONTENT_TYPE;
        return new ClassificationRecord(
                id,
                upload.content(),
                contentType,
                id + extensionOf(upload.originalFilename()),
                location,
                timestamp,
                detections,
                detections.size(),
                ClassificationRecord.summarize(detections));
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return DEFAULT_EXTENSION;
        }
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = filename.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
