package github.sarthakdev143.solar_movies.exception;

import github.sarthakdev143.solar_movies.model.MovieErrorType;

/**
 * Job-fatal failure. The message is for logs only; clients see {@link MovieErrorType#publicMessage()}.
 */
public abstract class MovieGenerationException extends RuntimeException {

    protected MovieGenerationException(String message) {
        super(message);
    }

    protected MovieGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract MovieErrorType errorType();
}
