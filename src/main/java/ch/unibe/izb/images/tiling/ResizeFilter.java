package ch.unibe.izb.images.tiling;

import org.imgscalr.Scalr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.util.Locale;

/**
 * Resampling kernels used to produce the lower resolution levels of a pyramid.
 */
public enum ResizeFilter {

    NEAREST("nearest", null),
    BILINEAR("bilinear", Scalr.Method.BALANCED),
    BICUBIC("bicubic", Scalr.Method.QUALITY),
    CUBIC("cubic", Scalr.Method.QUALITY),
    ANTIALIAS("antialias", Scalr.Method.ULTRA_QUALITY);

    private static final Logger log = LoggerFactory.getLogger(ResizeFilter.class);

    public static final ResizeFilter DEFAULT = ANTIALIAS;

    private final String filterName;
    private final Scalr.Method scalrMethod;

    ResizeFilter(String filterName, Scalr.Method scalrMethod) {
        this.filterName = filterName;
        this.scalrMethod = scalrMethod;
    }

    public String getFilterName() {
        return filterName;
    }

    /**
     * Resize the source to exactly width x height. The source is never modified.
     */
    public BufferedImage resize(BufferedImage src, int width, int height) {
        if (scalrMethod == null) {
            return resizeNearestNeighbour(src, width, height);
        }
        return Scalr.resize(src, scalrMethod, Scalr.Mode.FIT_EXACT, width, height);
    }

    private static BufferedImage resizeNearestNeighbour(BufferedImage src, int width, int height) {
        int type = src.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage result = new BufferedImage(width, height, type);
        Graphics2D g = result.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.drawImage(src, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return result;
    }

    /**
     * Look up a filter by name, ignoring case. Anything unknown, including null, maps to {@link #DEFAULT}.
     */
    public static ResizeFilter fromName(String name) {
        if (name != null) {
            String lowerCaseName = name.trim().toLowerCase(Locale.ROOT);
            for (ResizeFilter filter : values()) {
                if (filter.filterName.equals(lowerCaseName)) {
                    return filter;
                }
            }
        }
        log.warn("Unsupported resize filter '{}', using {}", name, DEFAULT.filterName);
        return DEFAULT;
    }

    @Override
    public String toString() {
        return filterName;
    }
}
