package github.sarthakdev143.solar_movies.dto;

public record RegionOfInterestRequest(
        Double top,
        Double left,
        Double bottom,
        Double right,
        Double imageScale) {
}
