package ch.unibe.izb.images.util;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import org.imgscalr.Scalr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Decodes source images, preferring the TwelveMonkeys readers where they are installed and applying the EXIF
 * orientation so that the decoded image is upright.
 */
public class ImageReaderUtils {

    protected static Logger logger = LoggerFactory.getLogger(ImageReaderUtils.class);

    static final String PREFERRED_READER_VENDOR = "twelvemonkeys";

    public static BufferedImage readImage(Path path) throws IOException {
        BufferedImage image;
        try (ImageInputStream iis = ImageIO.createImageInputStream(path.toFile())) {
            if (iis == null) {
                throw new IOException("Failed to create ImageInputStream for " + path);
            }
            ImageReader reader = selectImageReader(ImageIO.getImageReaders(iis));
            if (reader == null) {
                throw new IOException("No image readers for " + path);
            }
            try {
                reader.setInput(iis, true, true);
                image = reader.read(0);
                logger.trace("Read {} ({}x{}) with {}", path, image.getWidth(), image.getHeight(), reader.getClass().getName());
            } finally {
                reader.dispose();
            }
        } catch (RuntimeException e) {
            // some readers signal corrupt data with unchecked exceptions
            throw new IOException("Unable to decode " + path, e);
        }

        Orientation orientation = readOrientation(path);
        if (orientation != Orientation.Normal) {
            logger.debug("Applying orientation {} to {}", orientation, path);
            for (Scalr.Rotation rotation : orientation.getScalrRotations()) {
                BufferedImage rotated = Scalr.rotate(image, rotation);
                image.flush();
                image = rotated;
            }
        }
        return image;
    }

    static ImageReader selectImageReader(Iterator<ImageReader> candidates) {
        ImageReader first = null;
        while (candidates.hasNext()) {
            ImageReader reader = candidates.next();
            if (reader.getClass().getName().contains(PREFERRED_READER_VENDOR)) {
                return reader;
            }
            if (first == null) {
                first = reader;
            }
        }
        return first;
    }

    /**
     * The EXIF orientation of an image file, {@code Normal} if it has none or the metadata can't be read.
     */
    public static Orientation readOrientation(Path path) {
        try (InputStream is = new BufferedInputStream(Files.newInputStream(path))) {
            Metadata metadata = ImageMetadataReader.readMetadata(is);
            for (ExifIFD0Directory exif : metadata.getDirectoriesOfType(ExifIFD0Directory.class)) {
                if (exif.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                    return Orientation.fromExifOrientation(exif.getInt(ExifIFD0Directory.TAG_ORIENTATION));
                }
            }
        } catch (ImageProcessingException | MetadataException | IOException e) {
            logger.debug("Could not read orientation of {}", path, e);
        }
        return Orientation.Normal;
    }

    public enum Orientation {
        Normal(1, List.of()),
        FlipH(2, List.of(Scalr.Rotation.FLIP_HORZ)),
        Rotate180(3, List.of(Scalr.Rotation.CW_180)),
        FlipV(4, List.of(Scalr.Rotation.FLIP_VERT)),
        FlipVRotate90(5, List.of(Scalr.Rotation.FLIP_VERT, Scalr.Rotation.CW_90)),
        Rotate270(6, List.of(Scalr.Rotation.CW_90)),
        FlipHRotate90(7, List.of(Scalr.Rotation.FLIP_HORZ, Scalr.Rotation.CW_90)),
        Rotate90(8, List.of(Scalr.Rotation.CW_270));

        private final int value; // EXIF orientation tag value
        private final List<Scalr.Rotation> scalrRotations;

        Orientation(int value, List<Scalr.Rotation> scalrRotations) {
            this.value = value;
            this.scalrRotations = scalrRotations;
        }

        public int value() {
            return value;
        }

        public List<Scalr.Rotation> getScalrRotations() {
            return scalrRotations;
        }

        public static Orientation fromExifOrientation(final int orientation) {
            for (Orientation o : values()) {
                if (o.value == orientation) {
                    return o;
                }
            }
            return Normal;
        }
    }
}
