package com.example.flowerclassifier.repository;

import com.example.flowerclassifier.exception.StoreUnavailableException;
import com.example.flowerclassifier.model.BoundingBox;
import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.Detection;
import com.example.flowerclassifier.model.GeoLocation;
import com.example.flowerclassifier.model.Stage;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MongoClassificationRepositoryTest {

    private static final String COLLECTION = "classifications";

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private final MongoClassificationRepository repository = new MongoClassificationRepository(mongoTemplate);

    @Test
    void insertStoresImageAsBase64WithFlatCoordinates() {
        repository.insert(sampleRecord("rec-1", new GeoLocation(37.7749, -122.4194)));

        ArgumentCaptor<ClassificationDocument> captor = ArgumentCaptor.forClass(ClassificationDocument.class);
        verify(mongoTemplate).insert(captor.capture(), eq(COLLECTION));
        ClassificationDocument document = captor.getValue();
        assertThat(document.getId()).isEqualTo("rec-1");
        assertThat(document.getImageBase64()).isEqualTo("AQID");
        assertThat(document.getLatitude()).isEqualTo(37.7749);
        assertThat(document.getLongitude()).isEqualTo(-122.4194);
        assertThat(document.getFlowers()).hasSize(2);
        assertThat(document.getFlowers().get(0).getBoundingBox()).containsExactly(1.0, 2.0, 30.0, 40.0);
        assertThat(document.getFlowers().get(0).getStage()).isEqualTo(0);
    }

    @Test
    void recordWithoutLocationHasNoCoordinates() {
        ClassificationDocument document = ClassificationDocument.fromRecord(sampleRecord("rec-2", null));

        assertThat(document.getLatitude()).isNull();
        assertThat(document.getLongitude()).isNull();
        assertThat(document.toRecord().location()).isNull();
    }

    @Test
    void findByIdRestoresTheStoredRecord() {
        ClassificationRecord stored = sampleRecord("rec-1", new GeoLocation(37.7749, -122.4194));
        when(mongoTemplate.findOne(any(Query.class), eq(ClassificationDocument.class), eq(COLLECTION)))
                .thenReturn(ClassificationDocument.fromRecord(stored));

        ClassificationRecord found = repository.findById("rec-1").orElseThrow();

        assertThat(found.id()).isEqualTo("rec-1");
        assertThat(found.image()).isEqualTo(stored.image());
        assertThat(found.imageContentType()).isEqualTo("image/jpeg");
        assertThat(found.imageFilename()).isEqualTo("rec-1.jpg");
        assertThat(found.location()).isEqualTo(stored.location());
        assertThat(found.timestamp()).isEqualTo(stored.timestamp());
        assertThat(found.detections()).isEqualTo(stored.detections());
        assertThat(found.flowerCount()).isEqualTo(2);
        assertThat(found.stageSummary()).containsOnly(entry(Stage.BUD, 1), entry(Stage.POST_ANTHESIS, 1));
    }

    @Test
    void findByIdOfUnknownRecordIsEmpty() {
        when(mongoTemplate.findOne(any(Query.class), eq(ClassificationDocument.class), eq(COLLECTION)))
                .thenReturn(null);

        Optional<ClassificationRecord> found = repository.findById("missing");

        assertThat(found).isEmpty();
    }

    @Test
    void findAllQueriesNewestFirst() {
        when(mongoTemplate.find(any(Query.class), eq(ClassificationDocument.class), eq(COLLECTION)))
                .thenReturn(List.of(
                        ClassificationDocument.fromRecord(sampleRecord("newer", null)),
                        ClassificationDocument.fromRecord(sampleRecord("older", null))));

        List<ClassificationRecord> records = repository.findAll();

        assertThat(records).extracting(ClassificationRecord::id).containsExactly("newer", "older");
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(ClassificationDocument.class), eq(COLLECTION));
        assertThat(query.getValue().getSortObject()).isEqualTo(new Document("timestamp", -1));
    }

    @Test
    void aggregationReadLeavesOutImageData() {
        ClassificationDocument withoutImage = ClassificationDocument.fromRecord(sampleRecord("rec-1", new GeoLocation(1.0, 2.0)));
        withoutImage.setImageBase64(null);
        when(mongoTemplate.find(any(Query.class), eq(ClassificationDocument.class), eq(COLLECTION)))
                .thenReturn(List.of(withoutImage));

        List<ClassificationRecord> records = repository.findAllWithoutImages();

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.image()).isEmpty();
            assertThat(record.flowerCount()).isEqualTo(2);
            assertThat(record.location()).isEqualTo(new GeoLocation(1.0, 2.0));
        });
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(ClassificationDocument.class), eq(COLLECTION));
        assertThat(query.getValue().getFieldsObject()).isEqualTo(new Document("image_base64", 0));
        assertThat(query.getValue().getSortObject()).isEqualTo(new Document("timestamp", -1));
    }

    @Test
    void deleteReportsWhetherARecordWasRemoved() {
        when(mongoTemplate.remove(any(Query.class), eq(ClassificationDocument.class), eq(COLLECTION)))
                .thenReturn(DeleteResult.acknowledged(1), DeleteResult.acknowledged(0));

        assertThat(repository.deleteById("rec-1")).isTrue();
        assertThat(repository.deleteById("rec-1")).isFalse();
    }

    @Test
    void unreachableStoreIsReportedAsUnavailable() {
        when(mongoTemplate.findOne(any(Query.class), eq(ClassificationDocument.class), eq(COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("Timed out after 5000 ms"));
        when(mongoTemplate.executeCommand(any(Document.class)))
                .thenThrow(new DataAccessResourceFailureException("Timed out after 5000 ms"));

        assertThatThrownBy(() -> repository.findById("rec-1"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("Timed out");
        assertThatThrownBy(repository::ping).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void corruptDocumentIsRejected() {
        ClassificationDocument document = ClassificationDocument.fromRecord(sampleRecord("rec-1", null));
        document.getFlowers().get(0).setStage(7);

        assertThatThrownBy(document::toRecord)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("rec-1");
    }

    private static ClassificationRecord sampleRecord(String id, GeoLocation location) {
        List<Detection> detections = List.of(
                new Detection(new BoundingBox(1, 2, 30, 40), Stage.BUD, 0.9),
                new Detection(new BoundingBox(50, 60, 80, 95.5), Stage.POST_ANTHESIS, 0.55));
        return new ClassificationRecord(id, new byte[]{1, 2, 3}, "image/jpeg", id + ".jpg", location,
                Instant.parse("2024-05-01T10:15:30.123Z"), detections, detections.size(),
                ClassificationRecord.summarize(detections));
    }
}
