package ch.unibe.izb.images.tiling;

import ch.unibe.izb.images.util.FileByteSinkFactory;
import com.google.common.base.Stopwatch;
import com.google.common.io.ByteSink;
import org.apache.commons.lang3.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Cuts an image into a Deep Zoom pyramid.
 * <p>
 * Each level is resampled from the original image, never from a neighbouring level, so resampling errors don't
 * accumulate towards the coarse levels. The full resolution level reuses the source image as is. Level work runs
 * on the level executor and the encoding and writing of single tiles on the io executor of the
 * {@link DeepZoomCreatorConfig}; the descriptor is written once every tile has been written.
 */
public class DeepZoomCreator implements IDeepZoomCreator {

    private static final Logger log = LoggerFactory.getLogger(DeepZoomCreator.class);

    public static final int MAX_TILE_OVERLAP = 10;

    static final Range<Integer> TILE_OVERLAP_RANGE = Range.between(0, MAX_TILE_OVERLAP);
    static final Range<Float> IMAGE_QUALITY_RANGE = Range.between(0.0f, 1.0f);

    private final int _tileSize;
    private final int _tileOverlap;
    private final TileFormat _tileFormat;
    private final float _imageQuality;
    private final ResizeFilter _resizeFilter;
    private final boolean _copyMetadata;
    private final TileEncoder _tileEncoder;

    private final ExecutorService levelThreadPool;
    private final ExecutorService ioThreadPool;

    static {
        ImageIO.scanForPlugins();
        ImageIO.setUseCache(false);
    }

    public DeepZoomCreator() {
        this(null);
    }

    public DeepZoomCreator(DeepZoomCreatorConfig config) {
        if (config == null) {
            config = new DeepZoomCreatorConfig();
        }
        if (config.getTileSize() <= 0) {
            throw new PyramidGeometryException(PyramidGeometryException.Kind.INVALID_TILING,
                    "Tile size must be positive but was " + config.getTileSize());
        }
        _tileSize = config.getTileSize();
        _tileOverlap = Math.min(TILE_OVERLAP_RANGE.fit(config.getTileOverlap()), _tileSize);
        _imageQuality = IMAGE_QUALITY_RANGE.fit(config.getImageQuality());
        _tileFormat = config.getTileFormat() != null ? config.getTileFormat() : TileFormat.DEFAULT;
        _resizeFilter = config.getResizeFilter() != null ? config.getResizeFilter() : ResizeFilter.DEFAULT;
        _copyMetadata = config.isCopyMetadata();
        Color background = config.getTileBackgroundColor() != null ? config.getTileBackgroundColor() : DeepZoomCreatorConfig.DEFAULT_TILE_BACKGROUND;
        _tileEncoder = new TileEncoder(_tileFormat, _imageQuality, background);

        levelThreadPool = config.getLevelExecutor();
        ioThreadPool = config.getIoExecutor();

        if (_tileOverlap != config.getTileOverlap()) {
            log.debug("Tile overlap {} clamped to {}", config.getTileOverlap(), _tileOverlap);
        }
        if (_imageQuality != config.getImageQuality()) {
            log.debug("Image quality {} clamped to {}", config.getImageQuality(), _imageQuality);
        }
        log.debug("DeepZoomCreator: tileSize={}, tileOverlap={}, tileFormat={}, imageQuality={}, resizeFilter={}, copyMetadata={}",
                _tileSize, _tileOverlap, _tileFormat, _imageQuality, _resizeFilter, _copyMetadata);
    }

    public int getTileSize() {
        return _tileSize;
    }

    public int getTileOverlap() {
        return _tileOverlap;
    }

    public TileFormat getTileFormat() {
        return _tileFormat;
    }

    public float getImageQuality() {
        return _imageQuality;
    }

    public ResizeFilter getResizeFilter() {
        return _resizeFilter;
    }

    public boolean isCopyMetadata() {
        return _copyMetadata;
    }

    public TileEncoder getTileEncoder() {
        return _tileEncoder;
    }

    @Override
    public DeepZoomResults create(BufferedImage sourceImage, Path destination, BooleanSupplier cancelled) throws IOException {
        Objects.requireNonNull(sourceImage, "sourceImage");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(cancelled, "cancelled");

        Stopwatch sw = Stopwatch.createStarted();
        DeepZoomDescriptor descriptor = new DeepZoomDescriptor(sourceImage.getWidth(), sourceImage.getHeight(),
                _tileSize, _tileOverlap, _tileFormat);
        Path tilesPath = DeepZoomDescriptor.getTilesPath(destination);
        log.debug("create: {} into {}", descriptor, tilesPath);

        TilerSink tilerSink = new TilerSink.PathBasedTilerSink(new FileByteSinkFactory(tilesPath), _tileFormat);
        RenderContext context = new RenderContext(sourceImage, descriptor, tilerSink, cancelled);

        List<CompletableFuture<List<CompletableFuture<Void>>>> levelFutures = IntStream.range(0, descriptor.getNumLevels())
                .mapToObj(level -> CompletableFuture.supplyAsync(() -> renderLevel(context, level), levelThreadPool))
                .collect(Collectors.toList());

        List<CompletableFuture<Void>> tileFutures = levelFutures.stream()
                .flatMap(f -> f.join().stream())
                .collect(Collectors.toList());
        CompletableFuture.allOf(tileFutures.toArray(new CompletableFuture[0])).join();

        context.rethrowFailures();
        if (context.isCancelled()) {
            log.info("Pyramid for {} cancelled after {} tiles", destination, context.tileCount.get());
            throw new CancellationException("Deep Zoom pyramid creation cancelled");
        }

        descriptor.save(destination);
        Path descriptorPath = DeepZoomDescriptor.getDescriptorPath(destination);
        log.info("Created {} ({} levels, {} tiles) in {}", descriptorPath, descriptor.getNumLevels(), context.tileCount.get(), sw.stop());
        return new DeepZoomResults(descriptor, descriptorPath, context.tileCount.get());
    }

    private List<CompletableFuture<Void>> renderLevel(RenderContext context, int level) {
        if (context.shouldStop()) {
            return List.of();
        }
        try {
            DeepZoomDescriptor descriptor = context.descriptor;
            TilerSink.LevelSink levelSink = context.tilerSink.getLevelSink(level);
            BufferedImage levelImage = getLevelImage(context.sourceImage, descriptor.getDimensions(level));
            DeepZoomDescriptor.Dimension numTiles = descriptor.getNumTiles(level);
            log.debug("renderLevel: level {} is {}x{} with {}x{} tiles", level, levelImage.getWidth(), levelImage.getHeight(),
                    numTiles.width, numTiles.height);

            List<CompletableFuture<Void>> tasks = new ArrayList<>(numTiles.width * numTiles.height);
            for (int column = 0; column < numTiles.width; column++) {
                for (int row = 0; row < numTiles.height; row++) {
                    if (context.shouldStop()) {
                        return tasks;
                    }
                    TileBounds bounds = descriptor.getTileBounds(level, column, row);
                    BufferedImage tile = levelImage.getSubimage(bounds.getX1(), bounds.getY1(), bounds.getWidth(), bounds.getHeight());
                    SaveTileTask task = new SaveTileTask(context, level, column, row, tile, levelSink.getTileSink(column, row));
                    tasks.add(CompletableFuture.runAsync(task, ioThreadPool));
                }
            }
            return tasks;
        } catch (IOException | RuntimeException e) {
            log.error("Error processing level " + level, e);
            context.fail(e);
            return List.of();
        }
    }

    /**
     * The source resampled to the level size, or the source itself at full resolution.
     */
    private BufferedImage getLevelImage(BufferedImage sourceImage, DeepZoomDescriptor.Dimension dimensions) {
        if (sourceImage.getWidth() == dimensions.width && sourceImage.getHeight() == dimensions.height) {
            return sourceImage;
        }
        return _resizeFilter.resize(sourceImage, dimensions.width, dimensions.height);
    }

    /**
     * Per call state shared by the level and tile tasks of one {@link #create} call.
     */
    private static final class RenderContext {
        final BufferedImage sourceImage;
        final DeepZoomDescriptor descriptor;
        final TilerSink tilerSink;
        final BooleanSupplier cancelled;
        final AtomicBoolean cancelObserved = new AtomicBoolean(false);
        final Queue<Exception> failures = new ConcurrentLinkedQueue<>();
        final AtomicInteger tileCount = new AtomicInteger();

        RenderContext(BufferedImage sourceImage, DeepZoomDescriptor descriptor, TilerSink tilerSink, BooleanSupplier cancelled) {
            this.sourceImage = sourceImage;
            this.descriptor = descriptor;
            this.tilerSink = tilerSink;
            this.cancelled = cancelled;
        }

        boolean shouldStop() {
            if (!failures.isEmpty()) {
                return true;
            }
            if (cancelled.getAsBoolean()) {
                cancelObserved.set(true);
                return true;
            }
            return false;
        }

        boolean isCancelled() {
            return cancelObserved.get() || cancelled.getAsBoolean();
        }

        void fail(Exception e) {
            failures.add(e);
        }

        void rethrowFailures() throws IOException {
            Exception first = failures.poll();
            if (first == null) {
                return;
            }
            for (Exception other : failures) {
                first.addSuppressed(other);
            }
            if (first instanceof IOException) {
                throw (IOException) first;
            }
            throw (RuntimeException) first;
        }
    }

    class SaveTileTask implements Runnable {
        protected final RenderContext context;
        protected final int level;
        protected final int column;
        protected final int row;
        protected final BufferedImage tile;
        protected final ByteSink tileSink;

        SaveTileTask(RenderContext context, int level, int column, int row, BufferedImage tile, ByteSink tileSink) {
            this.context = context;
            this.level = level;
            this.column = column;
            this.row = row;
            this.tile = tile;
            this.tileSink = tileSink;
        }

        public void run() {
            if (context.shouldStop()) {
                return;
            }
            try (OutputStream tileStream = tileSink.openBufferedStream()) {
                _tileEncoder.encode(tile, tileStream);
                context.tileCount.incrementAndGet();
                log.trace("Wrote tile {}/{}", level, TilerSink.tileFileName(column, row, _tileFormat));
            } catch (IOException | RuntimeException e) {
                log.error("Exception occurred saving tile " + level + "/" + column + "_" + row, e);
                context.fail(e);
            }
        }
    }
}
