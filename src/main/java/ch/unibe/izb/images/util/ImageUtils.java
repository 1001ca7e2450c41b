package ch.unibe.izb.images.util;

import org.imgscalr.Scalr;

import java.awt.*;
import java.awt.image.BufferedImage;

public class ImageUtils {

    public static BufferedImage scale(BufferedImage src, int destWidth, int destHeight) {
        return Scalr.resize(src, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, destWidth, destHeight);
    }

    /**
     * Paint an image onto an opaque RGB canvas of the same size, for encoders that can't store alpha.
     */
    public static BufferedImage flatten(BufferedImage src, Color background) {
        BufferedImage result = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = result.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return result;
    }

}
