package github.sarthakdev143.solar_movies.model;

import java.time.Instant;

public record MovieJobStatus(
        String id,
        String token,
        String name,
        MovieJobState state,
        float progress,
        Instant dateRequested,
        Instant updatedAt,
        long etaSeconds,
        MovieOutput output,
        MovieErrorType errorType) {

    public String errorMessage() {
        return errorType == null ? null : errorType.publicMessage();
    }
}
