package github.sarthakdev143.solar_movies.service;

import github.sarthakdev143.solar_movies.dto.MovieStatusResponse;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.model.MovieJobStatus;

import java.util.Optional;

public interface MovieService {

    MovieJobStatus submitMovie(MovieSubmissionRequest request);

    Optional<MovieStatusResponse> getMovieStatus(String id, String token);
}
