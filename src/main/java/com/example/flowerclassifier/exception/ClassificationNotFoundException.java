package com.example.flowerclassifier.exception;

public class ClassificationNotFoundException extends RuntimeException {

    private final String id;

    public ClassificationNotFoundException(String id) {
        super("Classification not found: " + id);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
