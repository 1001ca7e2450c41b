package ch.unibe.izb.images.tiling;

import ch.unibe.izb.images.util.ByteSinkFactory;
import com.google.common.io.ByteSink;

import java.io.IOException;

/**
 * Destination of the encoded tiles of a pyramid, addressed by level, column and row.
 */
public interface TilerSink {

    LevelSink getLevelSink(int level) throws IOException;

    interface LevelSink {
        ByteSink getTileSink(int column, int row);
    }

    /**
     * Deep Zoom layout: {@code <root>/<level>/<column>_<row>.<extension>}.
     */
    class PathBasedTilerSink implements TilerSink {

        private final ByteSinkFactory byteSinkFactory;
        private final TileFormat tileFormat;

        public PathBasedTilerSink(ByteSinkFactory byteSinkFactory, TileFormat tileFormat) throws IOException {
            this.byteSinkFactory = byteSinkFactory;
            this.tileFormat = tileFormat;
            this.byteSinkFactory.prepare();
        }

        public class LevelSink implements TilerSink.LevelSink {

            private final int level;

            LevelSink(int level) {
                this.level = level;
            }

            @Override
            public ByteSink getTileSink(int column, int row) {
                return byteSinkFactory.getByteSinkForNames(Integer.toString(level), tileFileName(column, row, tileFormat));
            }
        }

        @Override
        public LevelSink getLevelSink(int level) throws IOException {
            byteSinkFactory.prepareDirectory(Integer.toString(level));
            return new LevelSink(level);
        }
    }

    static String tileFileName(int column, int row, TileFormat tileFormat) {
        return column + "_" + row + "." + tileFormat.getExtension();
    }
}
