package github.sarthakdev143.solar_movies.model;

public enum ApiAction {
    QUEUE_MOVIE("queueMovie"),
    GET_MOVIE_STATUS("getMovieStatus"),
    TAKE_SCREENSHOT("takeScreenshot");

    private final String apiValue;

    ApiAction(String apiValue) {
        this.apiValue = apiValue;
    }

    public static ApiAction fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("action is required.");
        }

        String normalized = input.trim();
        for (ApiAction action : values()) {
            if (action.apiValue.equalsIgnoreCase(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("action must be one of queueMovie, getMovieStatus, takeScreenshot.");
    }

    public String toApiValue() {
        return apiValue;
    }
}
