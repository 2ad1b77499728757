package github.sarthakdev143.solar_movies.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record MovieFrame(
        Instant timestamp,
        Map<Integer, ImageReference> perLayerImageRef,
        Path compositePath,
        List<Integer> skippedSourceIds) {

    public static final String FILE_NAME_PATTERN = "frame-%05d.png";

    public MovieFrame {
        perLayerImageRef = perLayerImageRef == null ? Map.of() : Map.copyOf(perLayerImageRef);
        skippedSourceIds = skippedSourceIds == null ? List.of() : List.copyOf(skippedSourceIds);
    }

    public boolean degraded() {
        return !skippedSourceIds.isEmpty();
    }

    public static String fileName(int index) {
        return String.format(Locale.ROOT, FILE_NAME_PATTERN, index);
    }
}
