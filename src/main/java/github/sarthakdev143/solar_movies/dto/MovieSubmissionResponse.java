package github.sarthakdev143.solar_movies.dto;

public record MovieSubmissionResponse(
        String id,
        String token,
        long eta) {
}
