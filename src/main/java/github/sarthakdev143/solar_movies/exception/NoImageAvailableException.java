package github.sarthakdev143.solar_movies.exception;

import java.time.Instant;
import java.util.List;

public class NoImageAvailableException extends Exception {

    private final List<Integer> sourceIds;
    private final Instant timestamp;

    public NoImageAvailableException(List<Integer> sourceIds, Instant timestamp, String message) {
        super(message);
        this.sourceIds = List.copyOf(sourceIds);
        this.timestamp = timestamp;
    }

    public NoImageAvailableException(List<Integer> sourceIds, Instant timestamp, String message, Throwable cause) {
        super(message, cause);
        this.sourceIds = List.copyOf(sourceIds);
        this.timestamp = timestamp;
    }

    public List<Integer> getSourceIds() {
        return sourceIds;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
