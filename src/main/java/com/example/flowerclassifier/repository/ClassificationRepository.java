package com.example.flowerclassifier.repository;

import com.example.flowerclassifier.model.ClassificationRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of classification records, keyed by record id. Every
 * operation throws {@link com.example.flowerclassifier.exception.StoreUnavailableException}
 * when the store cannot be reached.
 */
public interface ClassificationRepository {

    void insert(ClassificationRecord record);

    Optional<ClassificationRecord> findById(String id);

    /**
     * @return all records, newest first
     */
    List<ClassificationRecord> findAll();

    /**
     * Same records and order as {@link #findAll()}, but without image bytes:
     * {@link ClassificationRecord#image()} is empty.
     */
    List<ClassificationRecord> findAllWithoutImages();

    /**
     * @return {@code false} when no record with this id existed
     */
    boolean deleteById(String id);

    void ping();
}
