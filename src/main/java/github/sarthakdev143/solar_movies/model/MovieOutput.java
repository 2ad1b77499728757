package github.sarthakdev143.solar_movies.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

public record MovieOutput(
        double frameRate,
        int numFrames,
        Instant startDate,
        Instant endDate,
        int width,
        int height,
        Path thumbnailPath,
        Map<MovieFormat, Path> outputPaths) {

    public MovieOutput {
        outputPaths = outputPaths == null ? Map.of() : Map.copyOf(outputPaths);
    }

    public Path primaryPath() {
        return outputPaths.get(MovieFormat.MP4);
    }
}
