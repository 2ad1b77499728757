package github.sarthakdev143.solar_movies.model;

public enum MovieJobState {
    QUEUED(0),
    PROCESSING(1),
    COMPLETED(2),
    ERROR(3);

    private final int code;

    MovieJobState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    public static MovieJobState fromCode(int code) {
        for (MovieJobState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown movie status code: " + code);
    }
}
