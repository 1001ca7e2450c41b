package ch.unibe.izb.images.tiling;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * Pixel box of a single tile within its level, upper bounds exclusive.
 */
public final class TileBounds {

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public TileBounds(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public int getX1() {
        return x1;
    }

    public int getY1() {
        return y1;
    }

    public int getX2() {
        return x2;
    }

    public int getY2() {
        return y2;
    }

    public int getWidth() {
        return x2 - x1;
    }

    public int getHeight() {
        return y2 - y1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TileBounds)) return false;
        TileBounds that = (TileBounds) o;
        return x1 == that.x1 && y1 == that.y1 && x2 == that.x2 && y2 == that.y2;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("x1", x1)
                .add("y1", y1)
                .add("x2", x2)
                .add("y2", y2)
                .toString();
    }
}
