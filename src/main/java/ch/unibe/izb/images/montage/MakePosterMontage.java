package ch.unibe.izb.images.montage;

import ch.qos.logback.classic.Level;
import ch.unibe.izb.images.tiling.DeepZoomCreator;
import ch.unibe.izb.images.tiling.DeepZoomCreatorConfig;
import ch.unibe.izb.images.tiling.DeepZoomResults;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Combines the images of a directory into a montage on a grid and writes it as a Deep Zoom pyramid
 * ({@code <outdir>/<outfile>.dzi} plus {@code <outdir>/<outfile>_files/}), ready for a viewer such as OpenSeadragon.
 */
@Command(name = "make-poster-montage", mixinStandardHelpOptions = true,
        description = "Make a Deep Zoom pyramid from a grid montage of the images in a directory")
public class MakePosterMontage implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MakePosterMontage.class);

    @Parameters(index = "0", arity = "1", description = "Input folder with images")
    Path inputDirectory;

    @Option(names = {"-f", "--outfile"}, description = "Name of the output DZI file (default: ${DEFAULT-VALUE})")
    String outputFile = "dzi";

    @Option(names = {"-o", "--outdir"}, description = "Output folder for the DZI tiling (default: ${DEFAULT-VALUE})")
    Path outputDirectory = Path.of("dzi");

    @Option(names = {"-g", "--griddim"}, arity = "2", description = "Grid columns and rows (default: 3 3)")
    int[] gridDimensions = {3, 3};

    @Option(names = {"-m", "--imdim"}, arity = "2", description = "Width and height of a grid cell (default: 1024 1024)")
    int[] imageDimensions = {1024, 1024};

    @Option(names = {"-x", "--imext"}, description = "File extension of the images to combine (default: ${DEFAULT-VALUE})")
    String imageExtension = "png";

    @Option(names = {"-r", "--cores"}, description = "Number of worker threads (default: ${DEFAULT-VALUE})")
    int cores = 4;

    @Option(names = {"-t", "--tilesz"}, description = "Size of Deep Zoom tiles (default: ${DEFAULT-VALUE})")
    int tileSize = 254;

    @Option(names = "--overlap", description = "Tile overlap in pixels, 0 to 10 (default: ${DEFAULT-VALUE})")
    int tileOverlap = 1;

    @Option(names = {"-q", "--imquality"}, description = "JPEG quality or PNG compression trade-off, 0 to 1 (default: ${DEFAULT-VALUE})")
    float imageQuality = 0.8f;

    @Option(names = "--format", description = "Tile format, png or jpg (default: ${DEFAULT-VALUE})")
    String tileFormat = "png";

    @Option(names = "--filter", description = "Resize filter: nearest, bilinear, bicubic, cubic or antialias (default: ${DEFAULT-VALUE})")
    String resizeFilter = "antialias";

    @Option(names = {"-v", "--verbose"}, description = "Verbose, same as --log-level DEBUG")
    boolean verbose;

    @Option(names = "--log-level", description = "Change logging level; valid values are OFF, ERROR, WARN, INFO, DEBUG, TRACE and ALL (default: ${DEFAULT-VALUE})")
    String logLevel = "INFO";

    public static void main(String[] args) {
        System.exit(new CommandLine(new MakePosterMontage()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        setupLogger();
        if (cores <= 0) {
            log.error("--cores must be positive but was {}", cores);
            return 2;
        }

        Stopwatch sw = Stopwatch.createStarted();
        Path destination = outputDirectory.resolve(outputFile + ".dzi");

        DeepZoomCreatorConfig config = new DeepZoomCreatorConfig(cores, cores);
        config.setTileSize(tileSize);
        config.setTileOverlap(tileOverlap);
        config.setImageQuality(imageQuality);
        config.setTileFormat(tileFormat);
        config.setResizeFilter(resizeFilter);
        try {
            PosterMontage montage = new PosterMontage(gridDimensions[0], gridDimensions[1], imageDimensions[0], imageDimensions[1]);
            BufferedImage poster = montage.compose(inputDirectory, imageExtension);

            Files.createDirectories(outputDirectory);
            log.info("Making Deep Zoom tiling in {}", destination);
            DeepZoomResults results = new DeepZoomCreator(config).create(poster, destination);
            log.info("Analysis finished: {} levels, {} tiles in {}", results.getZoomLevels(), results.getTileCount(), sw.stop());
            return 0;
        } catch (Exception e) {
            log.error("Failed to create {}", destination, e);
            return 1;
        } finally {
            config.shutdown();
            config.getLevelExecutor().awaitTermination(1, TimeUnit.MINUTES);
            config.getIoExecutor().awaitTermination(1, TimeUnit.MINUTES);
        }
    }

    private void setupLogger() {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(verbose ? Level.DEBUG : Level.toLevel(logLevel));
    }
}
