package ch.unibe.izb.images.util;

import com.google.common.io.ByteSink;
import com.google.common.io.MoreFiles;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Hands out byte sinks for files below a root directory, creating missing parent directories on the way.
 */
public class FileByteSinkFactory implements ByteSinkFactory {

    public static final Logger log = LoggerFactory.getLogger(FileByteSinkFactory.class);

    final Path rootDir;
    final boolean cleanRootDir;

    public FileByteSinkFactory(Path rootDir) {
        this(rootDir, false);
    }

    public FileByteSinkFactory(Path rootDir, boolean cleanRootDir) {
        this.rootDir = rootDir.toAbsolutePath();
        this.cleanRootDir = cleanRootDir;
    }

    public Path getRootDir() {
        return rootDir;
    }

    @Override
    public void prepare() throws IOException {
        if (cleanRootDir && Files.exists(rootDir)) {
            log.debug("Cleaning {}", rootDir);
            FileUtils.deleteDirectory(rootDir.toFile());
        }
        Files.createDirectories(rootDir);
    }

    @Override
    public void prepareDirectory(String... names) throws IOException {
        Files.createDirectories(resolve(names));
    }

    @Override
    public ByteSink getByteSinkForNames(String... names) {
        Path path = resolve(names);
        Path parent = path.getParent();
        if (!Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                // the write through the returned sink reports the failure
                log.error("Unable to create directories for {}", path, e);
            }
        }
        return MoreFiles.asByteSink(path);
    }

    private Path resolve(String... names) {
        Path path = rootDir;
        for (String name : names) {
            path = path.resolve(name);
        }
        return path;
    }
}
