package com.example.flowerclassifier.service.geo;

import com.drew.lang.Rational;
import com.drew.metadata.exif.GpsDirectory;
import com.example.flowerclassifier.model.GeoLocation;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExifGeolocationExtractorTest {

    private final ExifGeolocationExtractor extractor = new ExifGeolocationExtractor();

    @Test
    void readsGpsCoordinatesFromJpegExif() throws IOException {
        byte[] jpeg = withGpsExif(plainImage("jpg"), 'N', new long[][]{{37, 1}, {46, 1}, {2964, 100}},
                'W', new long[][]{{122, 1}, {25, 1}, {984, 100}});

        Optional<GeoLocation> location = extractor.extract(jpeg);

        assertThat(location).isPresent();
        assertThat(location.get().latitude()).isCloseTo(37.7749, within(1e-4));
        assertThat(location.get().longitude()).isCloseTo(-122.4194, within(1e-4));
    }

    @Test
    void imageWithoutExifHasNoLocation() throws IOException {
        assertThat(extractor.extract(plainImage("png"))).isEmpty();
        assertThat(extractor.extract(plainImage("jpg"))).isEmpty();
    }

    @Test
    void unreadableBytesHaveNoLocation() {
        assertThat(extractor.extract("not an image".getBytes(StandardCharsets.US_ASCII))).isEmpty();
        assertThat(extractor.extract(new byte[0])).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    void southAndEastReferencesSetSigns() {
        GpsDirectory gps = gps("S", degrees(33, 52, 4.0), "E", degrees(151, 12, 36.0));

        Optional<GeoLocation> location = extractor.fromGpsDirectory(gps);

        assertThat(location).isPresent();
        assertThat(location.get().latitude()).isCloseTo(-33.8678, within(1e-4));
        assertThat(location.get().longitude()).isCloseTo(151.21, within(1e-4));
    }

    @Test
    void missingReferenceYieldsNoLocation() {
        GpsDirectory gps = gps(null, degrees(33, 52, 4.0), "E", degrees(151, 12, 36.0));

        assertThat(extractor.fromGpsDirectory(gps)).isEmpty();
    }

    @Test
    void unknownReferenceYieldsNoLocation() {
        GpsDirectory gps = gps("X", degrees(33, 52, 4.0), "E", degrees(151, 12, 36.0));

        assertThat(extractor.fromGpsDirectory(gps)).isEmpty();
    }

    @Test
    void outOfRangeCoordinatesYieldNoLocation() {
        GpsDirectory gps = gps("N", degrees(95, 0, 0), "E", degrees(10, 0, 0));

        assertThat(extractor.fromGpsDirectory(gps)).isEmpty();
    }

    @Test
    void zeroDenominatorIsMalformed() {
        Rational[] broken = {new Rational(37, 1), new Rational(46, 0), new Rational(0, 1)};

        assertThat(ExifGeolocationExtractor.toDecimalDegrees(broken)).isNull();
        assertThat(ExifGeolocationExtractor.toDecimalDegrees(new Rational[]{new Rational(1, 1)})).isNull();
        assertThat(ExifGeolocationExtractor.toDecimalDegrees(null)).isNull();
    }

    private static GpsDirectory gps(String latRef, Rational[] lat, String lonRef, Rational[] lon) {
        GpsDirectory gps = new GpsDirectory();
        if (latRef != null) {
            gps.setString(GpsDirectory.TAG_LATITUDE_REF, latRef);
        }
        gps.setRationalArray(GpsDirectory.TAG_LATITUDE, lat);
        if (lonRef != null) {
            gps.setString(GpsDirectory.TAG_LONGITUDE_REF, lonRef);
        }
        gps.setRationalArray(GpsDirectory.TAG_LONGITUDE, lon);
        return gps;
    }

    private static Rational[] degrees(long degrees, long minutes, double seconds) {
        return new Rational[]{
                new Rational(degrees, 1),
                new Rational(minutes, 1),
                new Rational(Math.round(seconds * 100), 100)
        };
    }

    private static byte[] plainImage(String format) throws IOException {
        BufferedImage image = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(image, format, output);
        return output.toByteArray();
    }

    /**
     * Inserts an APP1 segment right after SOI carrying a big-endian TIFF
     * block: IFD0 with a GPS pointer, and a GPS IFD with both coordinates.
     */
    private static byte[] withGpsExif(byte[] jpeg, char latRef, long[][] lat, char lonRef, long[][] lon) {
        ByteBuffer tiff = ByteBuffer.allocate(128).order(ByteOrder.BIG_ENDIAN);
        tiff.put((byte) 'M').put((byte) 'M').putShort((short) 0x2A).putInt(8);
        // IFD0 at 8: one entry pointing at the GPS IFD
        tiff.putShort((short) 1);
        tiff.putShort((short) 0x8825).putShort((short) 4).putInt(1).putInt(26);
        tiff.putInt(0);
        // GPS IFD at 26: four entries, rationals stored at 80 and 104
        tiff.putShort((short) 4);
        tiff.putShort((short) 0x0001).putShort((short) 2).putInt(2).put((byte) latRef).put((byte) 0).putShort((short) 0);
        tiff.putShort((short) 0x0002).putShort((short) 5).putInt(3).putInt(80);
        tiff.putShort((short) 0x0003).putShort((short) 2).putInt(2).put((byte) lonRef).put((byte) 0).putShort((short) 0);
        tiff.putShort((short) 0x0004).putShort((short) 5).putInt(3).putInt(104);
        tiff.putInt(0);
        for (long[] part : lat) {
            tiff.putInt((int) part[0]).putInt((int) part[1]);
        }
        for (long[] part : lon) {
            tiff.putInt((int) part[0]).putInt((int) part[1]);
        }

        byte[] exifHeader = "Exif\0\0".getBytes(StandardCharsets.US_ASCII);
        int segmentLength = 2 + exifHeader.length + tiff.capacity();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        output.write(jpeg, 0, 2);
        output.write(0xFF);
        output.write(0xE1);
        output.write((segmentLength >> 8) & 0xFF);
        output.write(segmentLength & 0xFF);
        output.write(exifHeader, 0, exifHeader.length);
        output.write(tiff.array(), 0, tiff.capacity());
        output.write(jpeg, 2, jpeg.length - 2);
        return output.toByteArray();
    }
}
