package github.sarthakdev143.solar_movies.exception;

import github.sarthakdev143.solar_movies.model.MovieErrorType;

public class EncodeException extends MovieGenerationException {

    private final String stage;
    private final Integer exitCode;

    public EncodeException(String stage, Integer exitCode, String message) {
        super(message);
        this.stage = stage;
        this.exitCode = exitCode;
    }

    public EncodeException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.exitCode = null;
    }

    public String getStage() {
        return stage;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    @Override
    public MovieErrorType errorType() {
        return MovieErrorType.ENCODE_FAILED;
    }
}
