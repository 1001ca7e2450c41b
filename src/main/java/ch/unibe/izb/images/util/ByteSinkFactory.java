package ch.unibe.izb.images.util;

import com.google.common.io.ByteSink;

import java.io.IOException;

/**
 * Byte sinks addressed by a path of names below some root.
 */
public interface ByteSinkFactory {
    void prepare() throws IOException;

    /**
     * Make sure the container named by the path exists before sinks below it are written.
     */
    void prepareDirectory(String... names) throws IOException;

    ByteSink getByteSinkForNames(String... names);
}
