package github.sarthakdev143.solar_movies.model;

public enum MovieErrorType {
    INVALID_GEOMETRY("The requested region of interest is invalid."),
    INSUFFICIENT_DATA("Not enough images for the requested time range."),
    ENCODE_FAILED("Movie encoding failed."),
    TIMEOUT("Movie generation timed out."),
    INTERNAL("Movie processing failed. Check server logs.");

    private final String publicMessage;

    MovieErrorType(String publicMessage) {
        this.publicMessage = publicMessage;
    }

    public String publicMessage() {
        return publicMessage;
    }
}
