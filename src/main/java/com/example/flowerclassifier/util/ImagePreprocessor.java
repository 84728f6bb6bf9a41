package com.example.flowerclassifier.util;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.nio.FloatBuffer;

/**
 * Image preparation for the detection model: channel normalization,
 * letterboxing to the square model input and conversion to a normalized
 * CHW float tensor. Pure Java2D, no native dependencies.
 */
public final class ImagePreprocessor {

    private static final Color LETTERBOX_FILL = new Color(114, 114, 114);

    private ImagePreprocessor() {
    }

    /**
     * Collapses any colour model (alpha, grayscale, indexed, 16-bit) to
     * three 8-bit RGB channels. Images that already are RGB are returned as is.
     */
    public static BufferedImage toRgb(BufferedImage input) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        if (input.getType() == BufferedImage.TYPE_INT_RGB) {
            return input;
        }
        BufferedImage rgb = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.drawImage(input, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }

    /**
     * Scales the image to fit a {@code size x size} square keeping the aspect
     * ratio and pads the remainder symmetrically with neutral gray.
     */
    public static Letterbox letterbox(BufferedImage rgb, int size) {
        double scale = Math.min(size / (double) rgb.getWidth(), size / (double) rgb.getHeight());
        int scaledWidth = Math.max(1, (int) Math.round(rgb.getWidth() * scale));
        int scaledHeight = Math.max(1, (int) Math.round(rgb.getHeight() * scale));
        int padX = (size - scaledWidth) / 2;
        int padY = (size - scaledHeight) / 2;

        BufferedImage canvas = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setColor(LETTERBOX_FILL);
            graphics.fillRect(0, 0, size, size);
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(rgb, padX, padY, scaledWidth, scaledHeight, null);
        } finally {
            graphics.dispose();
        }
        return new Letterbox(canvas, scale, padX, padY);
    }

    /**
     * @return pixel data as planar R, G, B floats in [0, 1]
     */
    public static FloatBuffer toChwTensor(BufferedImage rgb) {
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        int plane = width * height;
        int[] pixels = rgb.getRGB(0, 0, width, height, null, 0, width);
        FloatBuffer buffer = FloatBuffer.allocate(plane * 3);
        for (int i = 0; i < plane; i++) {
            int pixel = pixels[i];
            buffer.put(i, ((pixel >> 16) & 0xFF) / 255f);
            buffer.put(plane + i, ((pixel >> 8) & 0xFF) / 255f);
            buffer.put(2 * plane + i, (pixel & 0xFF) / 255f);
        }
        buffer.rewind();
        return buffer;
    }

    /**
     * Letterboxed image plus the transform needed to map model coordinates
     * back onto the source image.
     */
    public record Letterbox(BufferedImage image, double scale, int padX, int padY) {

        public double toSourceX(double modelX) {
            return (modelX - padX) / scale;
        }

        public double toSourceY(double modelY) {
            return (modelY - padY) / scale;
        }
    }
}
