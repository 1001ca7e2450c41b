package ch.unibe.izb.images.tiling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Encodings a tile can be written in. The extension doubles as the {@code Format} attribute of the descriptor.
 */
public enum TileFormat {

    PNG("png", "png"),
    JPG("jpg", "jpeg");

    private static final Logger log = LoggerFactory.getLogger(TileFormat.class);

    public static final TileFormat DEFAULT = PNG;

    private final String extension;
    private final String imageIoFormatName;

    TileFormat(String extension, String imageIoFormatName) {
        this.extension = extension;
        this.imageIoFormatName = imageIoFormatName;
    }

    public String getExtension() {
        return extension;
    }

    public String getImageIoFormatName() {
        return imageIoFormatName;
    }

    /**
     * Look up a format by its extension, ignoring case. Anything unknown, including null, maps to {@link #DEFAULT}.
     */
    public static TileFormat fromName(String name) {
        if (name != null) {
            String lowerCaseName = name.trim().toLowerCase(Locale.ROOT);
            for (TileFormat format : values()) {
                if (format.extension.equals(lowerCaseName)) {
                    return format;
                }
            }
        }
        log.warn("Unsupported tile format '{}', using {}", name, DEFAULT.extension);
        return DEFAULT;
    }

    @Override
    public String toString() {
        return extension;
    }
}
