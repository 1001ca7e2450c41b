package ch.unibe.izb.images.tiling;

import ch.unibe.izb.images.TestBase;
import com.google.common.base.Stopwatch;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

@RunWith(JUnit4.class)
public class DeepZoomCreatorTest extends TestBase {

    private Path tempDir;

    @Before
    public void setUp() throws Exception {
        tempDir = Files.createTempDirectory("dzi-creator-test");
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(tempDir.toFile());
    }

    private static DeepZoomCreatorConfig config(int tileSize, int overlap, TileFormat format) {
        DeepZoomCreatorConfig config = new DeepZoomCreatorConfig();
        config.setTileSize(tileSize);
        config.setTileOverlap(overlap);
        config.setTileFormat(format);
        return config;
    }

    private static Path tilePath(Path destination, int level, int column, int row, TileFormat format) {
        return DeepZoomDescriptor.getTilesPath(destination)
                .resolve(Integer.toString(level))
                .resolve(column + "_" + row + "." + format.getExtension());
    }

    private static int countFiles(Path directory) throws IOException {
        try (var files = Files.list(directory)) {
            return (int) files.count();
        }
    }

    @Test
    public void testLevelsAndTiles() throws Exception {
        BufferedImage image = createTestImage(300, 200);
        Path destination = tempDir.resolve("test.dzi");
        DeepZoomCreator creator = new DeepZoomCreator(config(64, 1, TileFormat.PNG));

        DeepZoomResults results = creator.create(image, destination);

        DeepZoomDescriptor descriptor = results.getDescriptor();
        assertEquals(10, results.getZoomLevels());
        assertEquals(destination.toAbsolutePath(), results.getDescriptorPath());
        assertTrue(Files.isRegularFile(results.getDescriptorPath()));

        Path tilesPath = DeepZoomDescriptor.getTilesPath(destination);
        int expectedTiles = 0;
        for (int level = 0; level < descriptor.getNumLevels(); level++) {
            DeepZoomDescriptor.Dimension numTiles = descriptor.getNumTiles(level);
            int levelTiles = numTiles.width * numTiles.height;
            assertEquals("level " + level, levelTiles, countFiles(tilesPath.resolve(Integer.toString(level))));
            expectedTiles += levelTiles;

            for (int column = 0; column < numTiles.width; column++) {
                for (int row = 0; row < numTiles.height; row++) {
                    TileBounds bounds = descriptor.getTileBounds(level, column, row);
                    BufferedImage tile = ImageIO.read(tilePath(destination, level, column, row, TileFormat.PNG).toFile());
                    assertNotNull(tile);
                    assertEquals(bounds.getWidth(), tile.getWidth());
                    assertEquals(bounds.getHeight(), tile.getHeight());
                }
            }
        }
        assertEquals(expectedTiles, results.getTileCount());
        assertEquals(1, countFiles(tilesPath.resolve("0")));
    }

    @Test
    public void testFullResolutionTilesReproduceTheSource() throws Exception {
        BufferedImage image = createTestImage(600, 400);
        Path destination = tempDir.resolve("stitch.dzi");
        DeepZoomCreator creator = new DeepZoomCreator(config(128, 2, TileFormat.PNG));

        DeepZoomDescriptor descriptor = creator.create(image, destination).getDescriptor();

        int level = descriptor.getMaxLevel();
        DeepZoomDescriptor.Dimension numTiles = descriptor.getNumTiles(level);
        BufferedImage stitched = new BufferedImage(600, 400, BufferedImage.TYPE_INT_RGB);
        for (int column = 0; column < numTiles.width; column++) {
            for (int row = 0; row < numTiles.height; row++) {
                TileBounds bounds = descriptor.getTileBounds(level, column, row);
                BufferedImage tile = ImageIO.read(tilePath(destination, level, column, row, TileFormat.PNG).toFile());
                for (int y = 0; y < tile.getHeight(); y++) {
                    for (int x = 0; x < tile.getWidth(); x++) {
                        int expected = image.getRGB(bounds.getX1() + x, bounds.getY1() + y);
                        assertEquals(expected, tile.getRGB(x, y));
                        stitched.setRGB(bounds.getX1() + x, bounds.getY1() + y, tile.getRGB(x, y));
                    }
                }
            }
        }
        for (int y = 0; y < 400; y++) {
            for (int x = 0; x < 600; x++) {
                assertEquals(image.getRGB(x, y), stitched.getRGB(x, y));
            }
        }
    }

    @Test
    public void testLowerLevelsAreResampledFromTheSource() throws Exception {
        BufferedImage image = createTestImage(500, 300);
        Path destination = tempDir.resolve("pattern.dzi");
        DeepZoomCreator creator = new DeepZoomCreator(config(100, 1, TileFormat.PNG));

        DeepZoomDescriptor descriptor = creator.create(image, destination).getDescriptor();

        for (int level = descriptor.getMaxLevel() - 2; level < descriptor.getMaxLevel(); level++) {
            DeepZoomDescriptor.Dimension dims = descriptor.getDimensions(level);
            BufferedImage expected = creator.getResizeFilter().resize(image, dims.width, dims.height);
            DeepZoomDescriptor.Dimension numTiles = descriptor.getNumTiles(level);
            for (int column = 0; column < numTiles.width; column++) {
                for (int row = 0; row < numTiles.height; row++) {
                    TileBounds bounds = descriptor.getTileBounds(level, column, row);
                    BufferedImage tile = ImageIO.read(tilePath(destination, level, column, row, TileFormat.PNG).toFile());
                    for (int y = 0; y < tile.getHeight(); y++) {
                        for (int x = 0; x < tile.getWidth(); x++) {
                            assertEquals("level " + level + " tile " + column + "_" + row + " at " + x + "," + y,
                                    expected.getRGB(bounds.getX1() + x, bounds.getY1() + y), tile.getRGB(x, y));
                        }
                    }
                }
            }
        }
    }

    @Test
    public void testDescriptorDocument() throws Exception {
        Path destination = tempDir.resolve("doc.dzi");
        new DeepZoomCreator(config(254, 1, TileFormat.PNG)).create(createTestImage(1024, 768), destination);

        String xml = new String(Files.readAllBytes(destination), StandardCharsets.UTF_8);
        println("%s", xml);
        assertTrue(xml.contains(DeepZoomDescriptor.NS_DEEPZOOM));
        assertTrue(xml.contains("TileSize=\"254\""));
        assertTrue(xml.contains("Overlap=\"1\""));
        assertTrue(xml.contains("Format=\"png\""));
        assertTrue(xml.contains("Width=\"1024\""));
        assertTrue(xml.contains("Height=\"768\""));

        DeepZoomDescriptor read = DeepZoomDescriptor.read(destination);
        assertEquals(11, read.getNumLevels());
    }

    @Test
    public void testRepeatedBuildsAreIdentical() throws Exception {
        BufferedImage image = createTestImage(400, 300);
        DeepZoomCreator creator = new DeepZoomCreator(config(128, 1, TileFormat.PNG));
        Path first = tempDir.resolve("first.dzi");
        Path second = tempDir.resolve("second.dzi");

        creator.create(image, first);
        creator.create(image, second);
        // a rebuild over an existing pyramid overwrites it in place
        DeepZoomResults again = creator.create(image, second);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
        DeepZoomDescriptor descriptor = again.getDescriptor();
        for (int level = 0; level < descriptor.getNumLevels(); level++) {
            DeepZoomDescriptor.Dimension numTiles = descriptor.getNumTiles(level);
            for (int column = 0; column < numTiles.width; column++) {
                for (int row = 0; row < numTiles.height; row++) {
                    assertArrayEquals(Files.readAllBytes(tilePath(first, level, column, row, TileFormat.PNG)),
                            Files.readAllBytes(tilePath(second, level, column, row, TileFormat.PNG)));
                }
            }
        }
    }

    @Test
    public void testJpegTiles() throws Exception {
        BufferedImage image = new BufferedImage(300, 150, BufferedImage.TYPE_INT_ARGB);
        Path destination = tempDir.resolve("photo.dzi");
        DeepZoomCreatorConfig config = config(128, 1, TileFormat.JPG);
        config.setImageQuality(0.9f);

        DeepZoomResults results = new DeepZoomCreator(config).create(image, destination);

        DeepZoomDescriptor descriptor = results.getDescriptor();
        assertEquals(TileFormat.JPG, descriptor.getTileFormat());
        assertTrue(new String(Files.readAllBytes(destination), StandardCharsets.UTF_8).contains("Format=\"jpg\""));
        int level = descriptor.getMaxLevel();
        BufferedImage tile = ImageIO.read(tilePath(destination, level, 2, 1, TileFormat.JPG).toFile());
        assertNotNull(tile);
        TileBounds bounds = descriptor.getTileBounds(level, 2, 1);
        assertEquals(bounds.getWidth(), tile.getWidth());
        assertEquals(bounds.getHeight(), tile.getHeight());
        assertFalse(Files.exists(tilePath(destination, level, 0, 0, TileFormat.PNG)));
    }

    @Test
    public void testParametersAreClamped() {
        DeepZoomCreatorConfig config = new DeepZoomCreatorConfig();
        config.setTileOverlap(15);
        config.setImageQuality(1.5f);
        config.setTileFormat("bmp");
        config.setResizeFilter("lanczos");
        DeepZoomCreator creator = new DeepZoomCreator(config);
        assertEquals(10, creator.getTileOverlap());
        assertEquals(1.0f, creator.getImageQuality(), 0.0f);
        assertEquals(TileFormat.PNG, creator.getTileFormat());
        assertEquals(ResizeFilter.ANTIALIAS, creator.getResizeFilter());

        config.setTileOverlap(-3);
        config.setImageQuality(-0.5f);
        creator = new DeepZoomCreator(config);
        assertEquals(0, creator.getTileOverlap());
        assertEquals(0.0f, creator.getImageQuality(), 0.0f);

        config.setTileSize(4);
        config.setTileOverlap(10);
        assertEquals(4, new DeepZoomCreator(config).getTileOverlap());
    }

    @Test
    public void testDefaults() {
        DeepZoomCreator creator = new DeepZoomCreator();
        assertEquals(254, creator.getTileSize());
        assertEquals(1, creator.getTileOverlap());
        assertEquals(TileFormat.PNG, creator.getTileFormat());
        assertEquals(0.8f, creator.getImageQuality(), 0.0f);
        assertEquals(ResizeFilter.ANTIALIAS, creator.getResizeFilter());
        assertFalse(creator.isCopyMetadata());
        assertEquals(2, creator.getTileEncoder().getPngCompressionLevel());
    }

    @Test
    public void testMissingBackgroundUsesDefault() {
        DeepZoomCreatorConfig config = new DeepZoomCreatorConfig();
        assertEquals(DeepZoomCreatorConfig.DEFAULT_TILE_BACKGROUND, new DeepZoomCreator(config).getTileEncoder().getBackgroundColor());
        config.setTileBackgroundColor(null);
        assertEquals(DeepZoomCreatorConfig.DEFAULT_TILE_BACKGROUND, new DeepZoomCreator(config).getTileEncoder().getBackgroundColor());
    }

    @Test
    public void testInvalidTileSize() {
        DeepZoomCreatorConfig config = new DeepZoomCreatorConfig();
        config.setTileSize(0);
        PyramidGeometryException e = assertThrows(PyramidGeometryException.class, () -> new DeepZoomCreator(config));
        assertEquals(PyramidGeometryException.Kind.INVALID_TILING, e.getKind());
    }

    @Test
    public void testCancelledBeforeStart() throws Exception {
        Path destination = tempDir.resolve("cancelled.dzi");
        DeepZoomCreator creator = new DeepZoomCreator(config(64, 1, TileFormat.PNG));

        assertThrows(CancellationException.class, () -> creator.create(createTestImage(300, 300), destination, () -> true));
        assertFalse(Files.exists(destination));
    }

    @Test
    public void testCancelledWhileRunning() throws Exception {
        Path destination = tempDir.resolve("cancelled.dzi");
        DeepZoomCreator creator = new DeepZoomCreator(config(64, 1, TileFormat.PNG));
        AtomicInteger polls = new AtomicInteger();

        assertThrows(CancellationException.class,
                () -> creator.create(createTestImage(300, 300), destination, () -> polls.incrementAndGet() > 20));
        assertFalse(Files.exists(destination));
        assertTrue(polls.get() > 20);
    }

    @Test
    public void testUnwritableTileDirectory() throws Exception {
        Path destination = tempDir.resolve("blocked.dzi");
        Files.write(DeepZoomDescriptor.getTilesPath(destination), new byte[]{1, 2, 3});
        DeepZoomCreator creator = new DeepZoomCreator(config(64, 1, TileFormat.PNG));

        assertThrows(IOException.class, () -> creator.create(createTestImage(100, 100), destination));
        assertFalse(Files.exists(destination));
    }

    @Test
    public void testThreadPools() throws Exception {
        DeepZoomCreatorConfig config = new DeepZoomCreatorConfig(3, 2);
        config.setTileSize(128);
        try {
            BufferedImage image = createTestImage(1000, 700);
            Path destination = tempDir.resolve("pooled.dzi");
            var sw = Stopwatch.createStarted();
            DeepZoomResults results = new DeepZoomCreator(config).create(image, destination);
            println("Pooled build took %s", sw.stop());

            DeepZoomDescriptor descriptor = results.getDescriptor();
            int expectedTiles = 0;
            for (int level = 0; level < descriptor.getNumLevels(); level++) {
                DeepZoomDescriptor.Dimension numTiles = descriptor.getNumTiles(level);
                expectedTiles += numTiles.width * numTiles.height;
            }
            assertEquals(expectedTiles, results.getTileCount());
            assertTrue(Files.exists(destination));

            BufferedImage tile = ImageIO.read(tilePath(destination, descriptor.getMaxLevel(), 3, 2, TileFormat.PNG).toFile());
            TileBounds bounds = descriptor.getTileBounds(descriptor.getMaxLevel(), 3, 2);
            assertEquals(image.getRGB(bounds.getX1(), bounds.getY1()), tile.getRGB(0, 0));
        } finally {
            config.shutdown();
        }
    }

    @Test
    public void testCreateFromFile() throws Exception {
        Path source = tempDir.resolve("source.png");
        ImageIO.write(createTestImage(200, 100), "png", source.toFile());
        Path destination = tempDir.resolve("out").resolve("fromfile.dzi");

        DeepZoomResults results = new DeepZoomCreator(config(64, 1, TileFormat.PNG)).create(source.toFile(), destination);

        assertEquals(200, results.getDescriptor().getWidth());
        assertEquals(100, results.getDescriptor().getHeight());
        assertTrue(Files.exists(destination));
        assertTrue(Files.isDirectory(tempDir.resolve("out").resolve("fromfile_files")));
    }
}
