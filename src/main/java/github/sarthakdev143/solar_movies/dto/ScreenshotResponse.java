package github.sarthakdev143.solar_movies.dto;

import java.util.List;

public record ScreenshotResponse(
        String id,
        String url,
        int width,
        int height,
        List<Integer> skippedSourceIds) {

    public ScreenshotResponse {
        skippedSourceIds = skippedSourceIds == null ? List.of() : List.copyOf(skippedSourceIds);
    }
}
