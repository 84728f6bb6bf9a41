package com.example.flowerclassifier.repository;

import com.example.flowerclassifier.exception.StoreUnavailableException;
import com.example.flowerclassifier.model.ClassificationRecord;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Repository
public class MongoClassificationRepository implements ClassificationRepository {

    private final MongoTemplate mongoTemplate;

    public MongoClassificationRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void insert(ClassificationRecord record) {
        ClassificationDocument document = ClassificationDocument.fromRecord(record);
        execute("insert", () -> mongoTemplate.insert(document, ClassificationDocument.COLLECTION));
    }

    @Override
    public Optional<ClassificationRecord> findById(String id) {
        ClassificationDocument document = execute("find",
                () -> mongoTemplate.findOne(byId(id), ClassificationDocument.class, ClassificationDocument.COLLECTION));
        return Optional.ofNullable(document).map(ClassificationDocument::toRecord);
    }

    @Override
    public List<ClassificationRecord> findAll() {
        return list(newestFirst());
    }

    @Override
    public List<ClassificationRecord> findAllWithoutImages() {
        Query query = newestFirst();
        query.fields().exclude("image_base64");
        return list(query);
    }

    private List<ClassificationRecord> list(Query query) {
        List<ClassificationDocument> documents = execute("list",
                () -> mongoTemplate.find(query, ClassificationDocument.class, ClassificationDocument.COLLECTION));
        return documents.stream()
                .map(ClassificationDocument::toRecord)
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteById(String id) {
        DeleteResult result = execute("delete",
                () -> mongoTemplate.remove(byId(id), ClassificationDocument.class, ClassificationDocument.COLLECTION));
        return result.getDeletedCount() > 0;
    }

    @Override
    public void ping() {
        execute("ping", () -> mongoTemplate.executeCommand(new Document("ping", 1)));
    }

    private Query newestFirst() {
        return new Query().with(Sort.by(Sort.Direction.DESC, "timestamp"));
    }

    private Query byId(String id) {
        return Query.query(Criteria.where("id").is(id));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("MongoDB " + operation + " failed: " + ex.getMessage(), ex);
        }
    }
}
