package ch.unibe.izb.images.tiling;

import ch.unibe.izb.images.util.ImageUtils;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * Writes single tiles with the compression settings derived from the image quality.
 * <p>
 * PNG is lossless, the quality only trades encoding effort against file size: the compression level is
 * {@code round((1 - quality) * 10)}. JPEG uses {@code round(quality * 100)} as its quality.
 */
public class TileEncoder {

    static final int MAX_DEFLATE_LEVEL = 9;

    private final TileFormat tileFormat;
    private final float imageQuality;
    private final Color backgroundColor;

    public TileEncoder(TileFormat tileFormat, float imageQuality, Color backgroundColor) {
        this.tileFormat = tileFormat;
        this.imageQuality = imageQuality;
        this.backgroundColor = backgroundColor;
    }

    public TileFormat getTileFormat() {
        return tileFormat;
    }

    public Color getBackgroundColor() {
        return backgroundColor;
    }

    public int getPngCompressionLevel() {
        return Math.round((1.0f - imageQuality) * 10.0f);
    }

    public int getJpegQuality() {
        return Math.round(imageQuality * 100.0f);
    }

    /**
     * The value handed to {@link ImageWriteParam#setCompressionQuality(float)}.
     */
    float getWriterCompressionQuality() {
        if (tileFormat == TileFormat.JPG) {
            return getJpegQuality() / 100.0f;
        }
        // the deflater tops out at level 9, a requested level of 10 is the same effort
        int deflateLevel = Math.min(getPngCompressionLevel(), MAX_DEFLATE_LEVEL);
        return 1.0f - (float) deflateLevel / MAX_DEFLATE_LEVEL;
    }

    public void encode(BufferedImage tile, OutputStream outputStream) throws IOException {
        BufferedImage image = tile;
        if (tileFormat == TileFormat.JPG && tile.getColorModel().hasAlpha()) {
            image = ImageUtils.flatten(tile, backgroundColor);
        }

        ImageWriter writer = getImageWriter();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(outputStream)) {
            if (ios == null) {
                throw new IOException("Unable to create an image output stream");
            }
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                if (param.getCompressionType() == null && param.getCompressionTypes() != null) {
                    param.setCompressionType(param.getCompressionTypes()[0]);
                }
                param.setCompressionQuality(getWriterCompressionQuality());
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
            if (image != tile) {
                image.flush();
            }
        }
    }

    private ImageWriter getImageWriter() throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(tileFormat.getImageIoFormatName());
        if (!writers.hasNext()) {
            throw new IOException("No image writer for " + tileFormat.getImageIoFormatName());
        }
        return writers.next();
    }
}
