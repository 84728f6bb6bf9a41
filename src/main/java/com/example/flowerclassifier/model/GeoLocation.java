package com.example.flowerclassifier.model;

/**
 * Decimal-degree coordinate pair. North and east are positive.
 */
public record GeoLocation(double latitude, double longitude) {

    public GeoLocation {
        if (!isValidLatitude(latitude)) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90 but was " + latitude);
        }
        if (!isValidLongitude(longitude)) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180 but was " + longitude);
        }
    }

    public static boolean isValidLatitude(double latitude) {
        return latitude >= -90 && latitude <= 90;
    }

    public static boolean isValidLongitude(double longitude) {
        return longitude >= -180 && longitude <= 180;
    }

    public static boolean isValid(double latitude, double longitude) {
        return isValidLatitude(latitude) && isValidLongitude(longitude);
    }
}
