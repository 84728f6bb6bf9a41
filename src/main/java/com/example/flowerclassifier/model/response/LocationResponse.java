package com.example.flowerclassifier.model.response;

import com.example.flowerclassifier.model.GeoLocation;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "GPS location in decimal degrees")
public record LocationResponse(
        @Schema(example = "37.7749") double latitude,
        @Schema(example = "-122.4194") double longitude) {

    public static LocationResponse from(GeoLocation location) {
        if (location == null) {
            return null;
        }
        return new LocationResponse(location.latitude(), location.longitude());
    }
}
