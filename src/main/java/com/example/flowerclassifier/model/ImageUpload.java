package com.example.flowerclassifier.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw upload as received from the client, before any decoding.
 */
public record ImageUpload(byte[] content, String contentType, String originalFilename) {

    public ImageUpload {
        content = content != null ? content.clone() : null;
    }

    @Override
    public byte[] content() {
        return content != null ? content.clone() : null;
    }

    public boolean isEmpty() {
        return content == null || content.length == 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImageUpload that)) {
            return false;
        }
        return Arrays.equals(content, that.content)
                && Objects.equals(contentType, that.contentType)
                && Objects.equals(originalFilename, that.originalFilename);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(contentType, originalFilename) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "ImageUpload[content=" + (content != null ? content.length + " bytes" : "null")
                + ", contentType=" + contentType
                + ", originalFilename=" + originalFilename + "]";
    }
}
