package github.sarthakdev143.solar_movies.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Validated, immutable description of a movie request.
 *
 * @param name     human readable layer summary, e.g. {@code "AIA 171, LASCO C2"}
 * @param fileName filesystem-safe base name shared by every artifact of the movie
 */
public record MovieRenderPlan(
        String name,
        String fileName,
        List<Layer> layers,
        FrameGeometry geometry,
        Instant startTime,
        double frameRate,
        int numFrames) {

    public MovieRenderPlan {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }

    public List<Layer> visibleLayersBackToFront() {
        return layers.stream()
                .filter(Layer::visible)
                .sorted(Comparator.comparingInt(Layer::layeringOrder))
                .toList();
    }
}
