package com.starscape.gallery.support;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Encoded images for thumbnail tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * A PNG with three equal vertical bands: red, green, blue.
     */
    public static byte[] bands(int width, int height) throws IOException {
        return encode(bandsImage(width, height), "png");
    }

    public static BufferedImage bandsImage(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        int band = width / 3;
        g.setColor(Color.RED);
        g.fillRect(0, 0, band, height);
        g.setColor(Color.GREEN);
        g.fillRect(band, 0, band, height);
        g.setColor(Color.BLUE);
        g.fillRect(2 * band, 0, width - 2 * band, height);
        g.dispose();
        return image;
    }

    /**
     * A JPEG filled with a vertical gradient.
     */
    public static byte[] gradient(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        for (int y = 0; y < height; y++) {
            int colorValue = (int) (255 * ((double) y / height));
            g.setColor(new Color(colorValue, colorValue, colorValue));
            g.drawLine(0, y, width, y);
        }
        g.dispose();
        return encode(image, "jpg");
    }

    private static byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, format, out);
        return out.toByteArray();
    }
}
