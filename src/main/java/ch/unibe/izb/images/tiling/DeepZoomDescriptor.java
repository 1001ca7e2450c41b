package ch.unibe.izb.images.tiling;

import com.google.common.base.MoreObjects;
import com.google.common.io.MoreFiles;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Geometry of a Deep Zoom image: the levels, their sizes, the tile grid of each level and the pixel box of each
 * tile. Level 0 is the coarsest level, level {@code getNumLevels() - 1} is the full resolution image.
 * <p>
 * Instances are immutable. Every query validates its level and tile arguments and throws a
 * {@link PyramidGeometryException} when they are out of range.
 */
public class DeepZoomDescriptor {

    private static final Logger log = LoggerFactory.getLogger(DeepZoomDescriptor.class);

    public static final String NS_DEEPZOOM = "http://schemas.microsoft.com/deepzoom/2008";
    public static final String DESCRIPTOR_EXTENSION = "dzi";
    public static final String TILES_SUFFIX = "_files";

    public static final int DEFAULT_TILE_SIZE = 254;
    public static final int DEFAULT_TILE_OVERLAP = 1;

    private final int width;
    private final int height;
    private final int tileSize;
    private final int tileOverlap;
    private final TileFormat tileFormat;
    private final int numLevels;

    public DeepZoomDescriptor(int width, int height) {
        this(width, height, DEFAULT_TILE_SIZE, DEFAULT_TILE_OVERLAP, TileFormat.DEFAULT);
    }

    public DeepZoomDescriptor(int width, int height, int tileSize, int tileOverlap, TileFormat tileFormat) {
        if (width <= 0 || height <= 0) {
            throw new PyramidGeometryException(PyramidGeometryException.Kind.INVALID_DIMENSIONS,
                    String.format("Invalid image dimensions %dx%d", width, height));
        }
        if (tileSize <= 0 || tileOverlap < 0 || tileOverlap > tileSize) {
            throw new PyramidGeometryException(PyramidGeometryException.Kind.INVALID_TILING,
                    String.format("Invalid tile size %d with overlap %d", tileSize, tileOverlap));
        }
        this.width = width;
        this.height = height;
        this.tileSize = tileSize;
        this.tileOverlap = tileOverlap;
        this.tileFormat = tileFormat != null ? tileFormat : TileFormat.DEFAULT;
        this.numLevels = computeNumLevels(Math.max(width, height));
    }

    /**
     * ceil(log2(maxDimension)) + 1, in integer arithmetic so exact powers of two don't suffer from rounding.
     */
    static int computeNumLevels(int maxDimension) {
        return (Integer.SIZE - Integer.numberOfLeadingZeros(maxDimension - 1)) + 1;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getTileSize() {
        return tileSize;
    }

    public int getTileOverlap() {
        return tileOverlap;
    }

    public TileFormat getTileFormat() {
        return tileFormat;
    }

    public int getNumLevels() {
        return numLevels;
    }

    public int getMaxLevel() {
        return numLevels - 1;
    }

    public double getScale(int level) {
        checkLevel(level);
        return Math.pow(0.5, getMaxLevel() - level);
    }

    public Dimension getDimensions(int level) {
        double scale = getScale(level);
        return new Dimension((int) Math.ceil(width * scale), (int) Math.ceil(height * scale));
    }

    /**
     * Number of tiles at a level, as columns (width) by rows (height).
     */
    public Dimension getNumTiles(int level) {
        Dimension dimensions = getDimensions(level);
        return new Dimension(ceilDiv(dimensions.width, tileSize), ceilDiv(dimensions.height, tileSize));
    }

    public TileBounds getTileBounds(int level, int column, int row) {
        Dimension numTiles = getNumTiles(level);
        if (column < 0 || column >= numTiles.width || row < 0 || row >= numTiles.height) {
            throw new PyramidGeometryException(PyramidGeometryException.Kind.INVALID_TILE_INDEX,
                    String.format("Invalid tile %d_%d for level %d with %dx%d tiles", column, row, level, numTiles.width, numTiles.height));
        }
        Dimension levelDimensions = getDimensions(level);

        int offsetX = column == 0 ? 0 : tileOverlap;
        int offsetY = row == 0 ? 0 : tileOverlap;
        int x = column * tileSize - offsetX;
        int y = row * tileSize - offsetY;

        int w = tileSize + (column == 0 ? 1 : 2) * tileOverlap;
        int h = tileSize + (row == 0 ? 1 : 2) * tileOverlap;
        w = Math.min(w, levelDimensions.width - x);
        h = Math.min(h, levelDimensions.height - y);

        return new TileBounds(x, y, x + w, y + h);
    }

    private void checkLevel(int level) {
        if (level < 0 || level >= numLevels) {
            throw new PyramidGeometryException(PyramidGeometryException.Kind.INVALID_LEVEL,
                    String.format("Invalid pyramid level %d, expected 0 to %d", level, getMaxLevel()));
        }
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }

    /**
     * The descriptor file for a destination, i.e. {@code <parent>/<base name>.dzi}.
     */
    public static Path getDescriptorPath(Path destination) {
        return resolveSibling(destination, "." + DESCRIPTOR_EXTENSION);
    }

    /**
     * The tile directory root for a destination, i.e. {@code <parent>/<base name>_files}.
     */
    public static Path getTilesPath(Path destination) {
        return resolveSibling(destination, TILES_SUFFIX);
    }

    private static Path resolveSibling(Path destination, String suffix) {
        Path absolute = destination.toAbsolutePath();
        String baseName = FilenameUtils.removeExtension(absolute.getFileName().toString());
        return absolute.resolveSibling(baseName + suffix);
    }

    /**
     * Write the descriptor document next to the tiles. The document is written to a temporary file first and
     * then moved into place, so a descriptor is either complete or absent.
     */
    public void save(Path destination) throws IOException {
        Path target = getDescriptorPath(destination);
        Files.createDirectories(target.getParent());
        byte[] document = toXml();

        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            MoreFiles.asByteSink(temp).write(document);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to a plain move", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote descriptor {}", target);
    }

    /**
     * Remove the descriptor file and the tile directory of a destination, if present.
     */
    public static void remove(Path destination) throws IOException {
        Path descriptor = getDescriptorPath(destination);
        Path tiles = getTilesPath(destination);
        Files.deleteIfExists(descriptor);
        FileUtils.deleteDirectory(tiles.toFile());
        log.debug("Removed {} and {}", descriptor, tiles);
    }

    byte[] toXml() throws IOException {
        try {
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            Element image = document.createElementNS(NS_DEEPZOOM, "Image");
            image.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE, NS_DEEPZOOM);
            image.setAttribute("TileSize", Integer.toString(tileSize));
            image.setAttribute("Overlap", Integer.toString(tileOverlap));
            image.setAttribute("Format", tileFormat.getExtension());
            Element size = document.createElementNS(NS_DEEPZOOM, "Size");
            size.setAttribute("Width", Integer.toString(width));
            size.setAttribute("Height", Integer.toString(height));
            image.appendChild(size);
            document.appendChild(image);

            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");

            ByteArrayOutputStream os = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(document), new StreamResult(os));
            return os.toByteArray();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IOException("Unable to serialise Deep Zoom descriptor", e);
        }
    }

    /**
     * Parse a descriptor document. The destination may name the {@code .dzi} file itself or any path sharing its
     * base name.
     */
    public static DeepZoomDescriptor read(Path destination) throws IOException {
        Path path = getDescriptorPath(destination);
        try (InputStream is = Files.newInputStream(path)) {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Document document = factory.newDocumentBuilder().parse(is);

            Element image = document.getDocumentElement();
            if (!NS_DEEPZOOM.equals(image.getNamespaceURI()) || !"Image".equals(image.getLocalName())) {
                throw new IOException("Not a Deep Zoom descriptor: " + path);
            }
            NodeList sizes = image.getElementsByTagNameNS(NS_DEEPZOOM, "Size");
            if (sizes.getLength() != 1) {
                throw new IOException("Expected exactly one Size element in " + path);
            }
            Element size = (Element) sizes.item(0);

            String format = image.getAttribute("Format");
            TileFormat tileFormat = TileFormat.fromName(format);
            if (!tileFormat.getExtension().equalsIgnoreCase(format)) {
                throw new IOException("Unsupported tile format '" + format + "' in " + path);
            }

            return new DeepZoomDescriptor(
                    parseAttribute(size, "Width", path),
                    parseAttribute(size, "Height", path),
                    parseAttribute(image, "TileSize", path),
                    parseAttribute(image, "Overlap", path),
                    tileFormat);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Unable to parse Deep Zoom descriptor " + path, e);
        } catch (PyramidGeometryException e) {
            throw new IOException("Invalid geometry in Deep Zoom descriptor " + path, e);
        }
    }

    private static int parseAttribute(Element element, String name, Path path) throws IOException {
        String value = element.getAttribute(name);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IOException(String.format("Invalid %s attribute '%s' in %s", name, value, path), e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", width)
                .add("height", height)
                .add("tileSize", tileSize)
                .add("tileOverlap", tileOverlap)
                .add("tileFormat", tileFormat)
                .add("numLevels", numLevels)
                .toString();
    }

    public static class Dimension {
        public final int width;
        public final int height;

        public Dimension(int width, int height) {
            this.width = width;
            this.height = height;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Dimension)) return false;
            Dimension that = (Dimension) o;
            return width == that.width && height == that.height;
        }

        @Override
        public int hashCode() {
            return 31 * width + height;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("width", width)
                    .add("height", height)
                    .toString();
        }
    }
}
