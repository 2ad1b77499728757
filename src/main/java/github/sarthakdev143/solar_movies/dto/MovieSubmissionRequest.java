package github.sarthakdev143.solar_movies.dto;

import java.time.Instant;
import java.util.List;

public record MovieSubmissionRequest(
        List<LayerRequest> layers,
        RegionOfInterestRequest roi,
        Instant startTime,
        Double frameRate,
        Integer numFrames) {

    public MovieSubmissionRequest {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }
}
