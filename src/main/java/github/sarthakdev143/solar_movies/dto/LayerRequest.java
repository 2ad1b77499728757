package github.sarthakdev143.solar_movies.dto;

public record LayerRequest(
        Integer sourceId,
        Boolean visible,
        Integer opacity,
        Integer layeringOrder) {
}
