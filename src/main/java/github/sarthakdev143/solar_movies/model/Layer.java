package github.sarthakdev143.solar_movies.model;

public record Layer(
        int sourceId,
        boolean visible,
        int opacity,
        int layeringOrder) {
}
