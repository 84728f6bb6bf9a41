package com.example.flowerclassifier.service;

import com.example.flowerclassifier.model.BoundingBox;
import com.example.flowerclassifier.model.ClassificationRecord;
import com.example.flowerclassifier.model.Detection;
import com.example.flowerclassifier.model.Stage;
import com.example.flowerclassifier.util.ImagePreprocessor;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Draws detection boxes and stage labels over a stored image. The stored
 * image itself is left untouched.
 */
@Component
public class AnnotatedImageRenderer {

    private static final Map<Stage, Color> STAGE_COLORS = new EnumMap<>(Stage.class);

    static {
        STAGE_COLORS.put(Stage.BUD, new Color(46, 204, 113));
        STAGE_COLORS.put(Stage.ANTHESIS, new Color(241, 196, 15));
        STAGE_COLORS.put(Stage.POST_ANTHESIS, new Color(231, 76, 60));
    }

    /**
     * @return the annotated image encoded as PNG
     */
    public byte[] render(ClassificationRecord record) {
        BufferedImage source = decode(record);
        BufferedImage canvas = ImagePreprocessor.toRgb(source);
        if (canvas == source) {
            canvas = copy(source);
        }
        int stroke = Math.max(2, Math.min(canvas.getWidth(), canvas.getHeight()) / 200);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setStroke(new BasicStroke(stroke));
            graphics.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(12, stroke * 6)));
            for (Detection detection : record.detections()) {
                drawDetection(graphics, detection);
            }
        } finally {
            graphics.dispose();
        }
        return encodePng(canvas);
    }

    private void drawDetection(Graphics2D graphics, Detection detection) {
        BoundingBox box = detection.boundingBox();
        Color color = STAGE_COLORS.get(detection.stage());
        int x = (int) Math.round(box.xMin());
        int y = (int) Math.round(box.yMin());
        int width = (int) Math.round(box.width());
        int height = (int) Math.round(box.height());

        graphics.setColor(color);
        graphics.drawRect(x, y, width, height);

        String label = String.format(Locale.ROOT, "%s %.0f%%", detection.stage().label(), detection.confidence() * 100);
        FontMetrics metrics = graphics.getFontMetrics();
        int labelHeight = metrics.getHeight();
        int labelY = y - labelHeight >= 0 ? y - labelHeight : y;
        graphics.fillRect(x, labelY, metrics.stringWidth(label) + 6, labelHeight);
        graphics.setColor(Color.BLACK);
        graphics.drawString(label, x + 3, labelY + metrics.getAscent());
    }

    private BufferedImage decode(ClassificationRecord record) {
        try (ByteArrayInputStream input = new ByteArrayInputStream(record.image())) {
            BufferedImage image = ImageIO.read(input);
            if (image == null) {
                throw new IllegalStateException("Stored image for " + record.id() + " cannot be decoded");
            }
            return image;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read stored image for " + record.id(), ex);
        }
    }

    private BufferedImage copy(BufferedImage image) {
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = copy.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return copy;
    }

    private byte[] encodePng(BufferedImage image) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", output)) {
                throw new IllegalStateException("PNG ImageWriter not available");
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to encode annotated image", ex);
        }
        return output.toByteArray();
    }
}
