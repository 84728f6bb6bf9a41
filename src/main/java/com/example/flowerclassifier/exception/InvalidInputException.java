package com.example.flowerclassifier.exception;

/**
 * Raised for malformed or unsupported client input: non-image uploads,
 * undecodable image data or incomplete manual coordinates.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
