package ch.unibe.izb.images.tiling;

/**
 * Thrown when a pyramid is described with impossible dimensions or queried outside of its levels or tile grid.
 */
public class PyramidGeometryException extends IllegalArgumentException {

    public enum Kind {
        INVALID_DIMENSIONS,
        INVALID_TILING,
        INVALID_LEVEL,
        INVALID_TILE_INDEX
    }

    private final Kind kind;

    public PyramidGeometryException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
