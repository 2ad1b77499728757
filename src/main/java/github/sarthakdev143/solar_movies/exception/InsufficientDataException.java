package github.sarthakdev143.solar_movies.exception;

import github.sarthakdev143.solar_movies.model.MovieErrorType;

public class InsufficientDataException extends MovieGenerationException {

    private final int viableFrames;
    private final int requiredFrames;

    public InsufficientDataException(int viableFrames, int requiredFrames) {
        super("Only " + viableFrames + " viable frames, at least " + requiredFrames + " required.");
        this.viableFrames = viableFrames;
        this.requiredFrames = requiredFrames;
    }

    public int getViableFrames() {
        return viableFrames;
    }

    public int getRequiredFrames() {
        return requiredFrames;
    }

    @Override
    public MovieErrorType errorType() {
        return MovieErrorType.INSUFFICIENT_DATA;
    }
}
