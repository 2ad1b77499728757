package github.sarthakdev143.solar_movies.exception;

public class InvalidGeometryException extends IllegalArgumentException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
