package ch.unibe.izb.images.tiling;

import java.nio.file.Path;

public class DeepZoomResults {

    private final DeepZoomDescriptor _descriptor;
    private final Path _descriptorPath;
    private final int _tileCount;

    public DeepZoomResults(DeepZoomDescriptor descriptor, Path descriptorPath, int tileCount) {
        _descriptor = descriptor;
        _descriptorPath = descriptorPath;
        _tileCount = tileCount;
    }

    public DeepZoomDescriptor getDescriptor() {
        return _descriptor;
    }

    public Path getDescriptorPath() {
        return _descriptorPath;
    }

    public int getZoomLevels() {
        return _descriptor.getNumLevels();
    }

    public int getTileCount() {
        return _tileCount;
    }

    @Override
    public String toString() {
        return "DeepZoomResults{_descriptorPath=" + _descriptorPath +
                ", _zoomLevels=" + getZoomLevels() +
                ", _tileCount=" + _tileCount +
                '}';
    }
}
