package ch.unibe.izb.images.montage;

import ch.unibe.izb.images.util.ImageReaderUtils;
import ch.unibe.izb.images.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pastes the images of a directory onto a single canvas, one image per grid cell, filling rows first.
 * Cells are separated by a padding gap; empty cells and gaps keep the background colour.
 */
public class PosterMontage {

    private static final Logger log = LoggerFactory.getLogger(PosterMontage.class);

    public static final int DEFAULT_PADDING = 10;
    public static final Color DEFAULT_BACKGROUND = new Color(10, 10, 10);

    private final int gridColumns;
    private final int gridRows;
    private final int cellWidth;
    private final int cellHeight;
    private int padding = DEFAULT_PADDING;
    private Color background = DEFAULT_BACKGROUND;

    public PosterMontage(int gridColumns, int gridRows, int cellWidth, int cellHeight) {
        if (gridColumns <= 0 || gridRows <= 0) {
            throw new IllegalArgumentException(String.format("Invalid grid %dx%d", gridColumns, gridRows));
        }
        if (cellWidth <= 0 || cellHeight <= 0) {
            throw new IllegalArgumentException(String.format("Invalid image dimensions %dx%d", cellWidth, cellHeight));
        }
        this.gridColumns = gridColumns;
        this.gridRows = gridRows;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
    }

    public int getPadding() {
        return padding;
    }

    public void setPadding(int padding) {
        if (padding < 0) {
            throw new IllegalArgumentException("Padding must not be negative but was " + padding);
        }
        this.padding = padding;
    }

    public Color getBackground() {
        return background;
    }

    public void setBackground(Color background) {
        this.background = background;
    }

    public int getCanvasWidth() {
        return cellWidth * gridColumns + padding * (gridColumns - 1);
    }

    public int getCanvasHeight() {
        return cellHeight * gridRows + padding * (gridRows - 1);
    }

    /**
     * Top left corner of the cell an image with the given index is pasted into.
     */
    public Point getCellOrigin(int index) {
        int column = index % gridColumns;
        int row = index / gridColumns;
        return new Point(column * (cellWidth + padding), row * (cellHeight + padding));
    }

    /**
     * Regular files in a directory whose name ends with the extension, sorted by name.
     */
    public static List<Path> listImages(Path directory, String extension) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public BufferedImage compose(Path directory, String extension) throws IOException {
        List<Path> files = listImages(directory, extension);
        log.debug("{} file(s) found in {}", files.size(), directory);
        return compose(files);
    }

    public BufferedImage compose(List<Path> files) {
        int cells = gridColumns * gridRows;
        if (files.size() > cells) {
            log.warn("Grid {}x{} holds {} images but {} were found, the rest are left out", gridColumns, gridRows, cells, files.size());
        }

        BufferedImage canvas = new BufferedImage(getCanvasWidth(), getCanvasHeight(), BufferedImage.TYPE_INT_RGB);
        log.debug("Making the montage: {}x{} pixels", canvas.getWidth(), canvas.getHeight());

        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

            for (int index = 0; index < Math.min(files.size(), cells); index++) {
                Path file = files.get(index);
                BufferedImage image;
                try {
                    image = ImageReaderUtils.readImage(file);
                } catch (IOException e) {
                    log.warn("Corrupted file {}, leaving its cell empty", file, e);
                    continue;
                }
                paste(g, image, getCellOrigin(index), file);
                image.flush();
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }

    private void paste(Graphics2D g, BufferedImage image, Point origin, Path file) {
        log.trace("Pasting {} at {},{}", file, origin.x, origin.y);
        if (image.getWidth() == cellWidth && image.getHeight() == cellHeight) {
            g.drawImage(image, origin.x, origin.y, null);
        } else {
            log.warn("{} is {}x{}, scaling it to {}x{}", file, image.getWidth(), image.getHeight(), cellWidth, cellHeight);
            BufferedImage scaled = ImageUtils.scale(image, cellWidth, cellHeight);
            g.drawImage(scaled, origin.x, origin.y, null);
            scaled.flush();
        }
    }
}
