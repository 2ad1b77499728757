package github.sarthakdev143.solar_movies.client;

import github.sarthakdev143.solar_movies.dto.MovieStatusResponse;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionResponse;

import java.util.Optional;

public interface MovieApiClient {

    MovieSubmissionResponse submitMovie(MovieSubmissionRequest request);

    /**
     * @return empty when the server does not know the job
     */
    Optional<MovieStatusResponse> getMovieStatus(String id, String token);
}
