package github.sarthakdev143.solar_movies.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import github.sarthakdev143.solar_movies.model.MovieJobState;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MovieStatusResponse(
        int status,
        Float progress,
        Double frameRate,
        Integer numFrames,
        Instant startDate,
        Instant endDate,
        Integer width,
        Integer height,
        String thumbnailUrl,
        String url,
        Map<String, String> formats,
        String error) {

    public static MovieStatusResponse pending(MovieJobState state, float progress) {
        return new MovieStatusResponse(
                state.code(), progress, null, null, null, null, null, null, null, null, null, null);
    }

    public static MovieStatusResponse completed(
            double frameRate,
            int numFrames,
            Instant startDate,
            Instant endDate,
            int width,
            int height,
            String thumbnailUrl,
            String url,
            Map<String, String> formats) {
        return new MovieStatusResponse(
                MovieJobState.COMPLETED.code(),
                null,
                frameRate,
                numFrames,
                startDate,
                endDate,
                width,
                height,
                thumbnailUrl,
                url,
                formats == null ? null : Map.copyOf(formats),
                null);
    }

    public static MovieStatusResponse failed(String error) {
        return new MovieStatusResponse(
                MovieJobState.ERROR.code(), null, null, null, null, null, null, null, null, null, null, error);
    }

    public MovieJobState state() {
        return MovieJobState.fromCode(status);
    }
}
