package github.sarthakdev143.solar_movies.exception;

import github.sarthakdev143.solar_movies.model.MovieErrorType;

import java.time.Duration;

public class JobTimeoutException extends MovieGenerationException {

    public JobTimeoutException(String jobId, Duration ceiling) {
        super("Movie job " + jobId + " exceeded the " + ceiling + " processing ceiling.");
    }

    @Override
    public MovieErrorType errorType() {
        return MovieErrorType.TIMEOUT;
    }
}
