package ch.unibe.izb.images.tiling;

import com.google.common.util.concurrent.MoreExecutors;

import java.awt.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class DeepZoomCreatorConfig {

    public static final Color DEFAULT_TILE_BACKGROUND = new Color(221, 221, 221);

    private ExecutorService _ioExecutor;
    private ExecutorService _levelExecutor;
    private int _tileSize = DeepZoomDescriptor.DEFAULT_TILE_SIZE;
    private int _tileOverlap = DeepZoomDescriptor.DEFAULT_TILE_OVERLAP;
    private TileFormat _tileFormat = TileFormat.DEFAULT;
    private float _imageQuality = 0.8f;
    private ResizeFilter _resizeFilter = ResizeFilter.DEFAULT;
    private boolean _copyMetadata = false;
    private Color _tileBackgroundColor = DEFAULT_TILE_BACKGROUND;

    /**
     * Runs everything on the calling thread.
     */
    public DeepZoomCreatorConfig() {
        this(MoreExecutors.newDirectExecutorService(), MoreExecutors.newDirectExecutorService());
    }

    public DeepZoomCreatorConfig(ExecutorService ioExecutor, ExecutorService levelExecutor) {
        this._ioExecutor = ioExecutor;
        this._levelExecutor = levelExecutor;
    }

    /**
     * Creates fixed size pools, the caller is responsible for shutting them down via {@link #shutdown()}.
     */
    public DeepZoomCreatorConfig(int ioThreads, int levelThreads) {
        this(Executors.newFixedThreadPool(ioThreads), Executors.newFixedThreadPool(levelThreads));
    }

    public DeepZoomCreatorConfig(ExecutorService ioExecutor, ExecutorService levelExecutor, int tileSize, int tileOverlap, TileFormat tileFormat) {
        this(ioExecutor, levelExecutor);
        _tileSize = tileSize;
        _tileOverlap = tileOverlap;
        _tileFormat = tileFormat;
    }

    public int getTileSize() {
        return _tileSize;
    }
    public void setTileSize(int tileSize) { _tileSize = tileSize; }

    public int getTileOverlap() {
        return _tileOverlap;
    }
    public void setTileOverlap(int tileOverlap) { _tileOverlap = tileOverlap; }

    public TileFormat getTileFormat() { return _tileFormat; }
    public void setTileFormat(TileFormat format) { _tileFormat = format; }
    public void setTileFormat(String format) { _tileFormat = TileFormat.fromName(format); }

    public float getImageQuality() { return _imageQuality; }
    public void setImageQuality(float imageQuality) { _imageQuality = imageQuality; }

    public ResizeFilter getResizeFilter() { return _resizeFilter; }
    public void setResizeFilter(ResizeFilter filter) { _resizeFilter = filter; }
    public void setResizeFilter(String filter) { _resizeFilter = ResizeFilter.fromName(filter); }

    public boolean isCopyMetadata() { return _copyMetadata; }
    public void setCopyMetadata(boolean copyMetadata) { _copyMetadata = copyMetadata; }

    public Color getTileBackgroundColor() { return _tileBackgroundColor; }
    public void setTileBackgroundColor(Color c) { _tileBackgroundColor = c; }

    public ExecutorService getIoExecutor() {
        return _ioExecutor;
    }

    public ExecutorService getLevelExecutor() {
        return _levelExecutor;
    }

    public void shutdown() {
        _levelExecutor.shutdown();
        _ioExecutor.shutdown();
    }
}
