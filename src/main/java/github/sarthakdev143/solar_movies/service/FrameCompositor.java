package github.sarthakdev143.solar_movies.service;

import github.sarthakdev143.solar_movies.exception.NoImageAvailableException;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.Layer;
import github.sarthakdev143.solar_movies.model.MovieFrame;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public interface FrameCompositor {

    /**
     * Composites every available layer for {@code timestamp} into a PNG at {@code outputPath}.
     * Layers without a usable image are skipped and listed in {@link MovieFrame#skippedSourceIds()}.
     *
     * @throws NoImageAvailableException if no layer has a usable image
     */
    MovieFrame composite(Instant timestamp, List<Layer> layers, FrameGeometry geometry, Path outputPath)
            throws NoImageAvailableException, IOException;
}
