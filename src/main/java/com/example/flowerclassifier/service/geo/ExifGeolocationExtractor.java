package com.example.flowerclassifier.service.geo;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.GpsDirectory;
import com.example.flowerclassifier.model.GeoLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the EXIF GPS block of an image. Missing or malformed GPS data yields
 * an empty result, never an exception.
 */
@Component
public class ExifGeolocationExtractor {

    private static final Logger log = LoggerFactory.getLogger(ExifGeolocationExtractor.class);

    public Optional<GeoLocation> extract(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            return Optional.empty();
        }
        Metadata metadata;
        try (InputStream input = new ByteArrayInputStream(imageBytes)) {
            metadata = ImageMetadataReader.readMetadata(input);
        } catch (ImageProcessingException | IOException | RuntimeException ex) {
            log.debug("Image metadata could not be read: {}", ex.getMessage());
            return Optional.empty();
        }
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (gps == null) {
            log.debug("Image carries no GPS metadata");
            return Optional.empty();
        }
        return fromGpsDirectory(gps);
    }

    Optional<GeoLocation> fromGpsDirectory(GpsDirectory gps) {
        Double latitude = signedDegrees(
                gps.getRationalArray(GpsDirectory.TAG_LATITUDE), gps.getString(GpsDirectory.TAG_LATITUDE_REF), "N", "S");
        Double longitude = signedDegrees(
                gps.getRationalArray(GpsDirectory.TAG_LONGITUDE), gps.getString(GpsDirectory.TAG_LONGITUDE_REF), "E", "W");
        if (latitude == null || longitude == null) {
            log.debug("GPS metadata incomplete or malformed");
            return Optional.empty();
        }
        if (!GeoLocation.isValid(latitude, longitude)) {
            log.debug("GPS metadata out of range: {}, {}", latitude, longitude);
            return Optional.empty();
        }
        return Optional.of(new GeoLocation(latitude, longitude));
    }

    private static Double signedDegrees(Rational[] dms, String reference, String positive, String negative) {
        Double degrees = toDecimalDegrees(dms);
        if (degrees == null || reference == null) {
            return null;
        }
        String hemisphere = reference.trim().toUpperCase(Locale.ROOT);
        if (positive.equals(hemisphere)) {
            return degrees;
        }
        if (negative.equals(hemisphere)) {
            return -degrees;
        }
        return null;
    }

    /**
     * @param dms degrees, minutes and seconds as EXIF rationals
     * @return decimal degrees, or {@code null} when the triple is malformed
     */
    static Double toDecimalDegrees(Rational[] dms) {
        if (dms == null || dms.length != 3) {
            return null;
        }
        for (Rational part : dms) {
            if (part == null || part.getDenominator() == 0) {
                return null;
            }
        }
        return dms[0].doubleValue() + dms[1].doubleValue() / 60.0 + dms[2].doubleValue() / 3600.0;
    }
}
