package github.sarthakdev143.solar_movies.dto;

import java.time.Instant;
import java.util.List;

public record ScreenshotRequest(
        List<LayerRequest> layers,
        RegionOfInterestRequest roi,
        Instant date) {

    public ScreenshotRequest {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }
}
