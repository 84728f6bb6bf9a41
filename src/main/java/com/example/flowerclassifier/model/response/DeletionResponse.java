package com.example.flowerclassifier.model.response;

public record DeletionResponse(String message, String id) {
}
