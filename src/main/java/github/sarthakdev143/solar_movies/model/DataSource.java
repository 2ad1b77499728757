package github.sarthakdev143.solar_movies.model;

public record DataSource(
        int id,
        String name,
        int layeringOrder) {
}
