package ch.unibe.izb.images.tiling;

import ch.unibe.izb.images.util.ImageReaderUtils;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Interface for creators that cut an image into a Deep Zoom tile pyramid.
 */
public interface IDeepZoomCreator {

    default DeepZoomResults create(File imageFile, Path destination) throws IOException {
        return create(ImageReaderUtils.readImage(imageFile.toPath()), destination);
    }

    default DeepZoomResults create(BufferedImage sourceImage, Path destination) throws IOException {
        return create(sourceImage, destination, () -> false);
    }

    /**
     * Write the tiles of every level followed by the descriptor.
     * @param sourceImage The full resolution image, only read.
     * @param destination The descriptor path; tiles go to the sibling {@code <base name>_files} directory.
     * @param cancelled Polled between levels and tiles, the build stops once it returns true.
     * @return The results of the build.
     * @throws IOException If a tile or the descriptor can't be encoded or written. The descriptor is not written.
     * @throws CancellationException If the build was cancelled. The descriptor is not written.
     */
    DeepZoomResults create(BufferedImage sourceImage, Path destination, BooleanSupplier cancelled) throws IOException;
}
