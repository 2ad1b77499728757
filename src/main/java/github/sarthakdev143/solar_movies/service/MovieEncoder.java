package github.sarthakdev143.solar_movies.service;

import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.MovieFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public interface MovieEncoder {

    Map<MovieFormat, Path> encode(
            List<Path> framePaths,
            double frameRate,
            FrameGeometry geometry,
            Path outputDirectory,
            String baseName) throws IOException, InterruptedException;
}
