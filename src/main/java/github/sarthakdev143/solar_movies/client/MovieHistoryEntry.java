package github.sarthakdev143.solar_movies.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import github.sarthakdev143.solar_movies.dto.MovieStatusResponse;
import github.sarthakdev143.solar_movies.model.MovieJobState;

import java.time.Instant;

/**
 * One locally remembered movie request. Output fields stay null until the movie completes.
 */
public record MovieHistoryEntry(
        String id,
        String token,
        String name,
        Instant dateRequested,
        MovieJobState status,
        float progress,
        Double frameRate,
        Integer numFrames,
        Instant startDate,
        Instant endDate,
        Integer width,
        Integer height,
        String thumbnailUrl,
        String url) {

    public static MovieHistoryEntry queued(String id, String token, String name, Instant dateRequested) {
        return new MovieHistoryEntry(
                id, token, name, dateRequested, MovieJobState.QUEUED, 0.0f,
                null, null, null, null, null, null, null, null);
    }

    public MovieHistoryEntry withProgress(MovieJobState newStatus, Float newProgress) {
        return new MovieHistoryEntry(
                id, token, name, dateRequested, newStatus, newProgress == null ? progress : newProgress,
                frameRate, numFrames, startDate, endDate, width, height, thumbnailUrl, url);
    }

    public MovieHistoryEntry completed(MovieStatusResponse response) {
        return new MovieHistoryEntry(
                id,
                token,
                name,
                dateRequested,
                MovieJobState.COMPLETED,
                1.0f,
                response.frameRate(),
                response.numFrames(),
                response.startDate(),
                response.endDate(),
                response.width(),
                response.height(),
                response.thumbnailUrl(),
                response.url());
    }

    public MovieHistoryEntry failed() {
        return new MovieHistoryEntry(
                id, token, name, dateRequested, MovieJobState.ERROR, progress,
                frameRate, numFrames, startDate, endDate, width, height, thumbnailUrl, url);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
