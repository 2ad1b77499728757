package github.sarthakdev143.solar_movies.client;

import github.sarthakdev143.solar_movies.dto.MovieStatusResponse;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionResponse;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.Optional;

public class RestMovieApiClient implements MovieApiClient {

    private final RestClient restClient;

    public RestMovieApiClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public MovieSubmissionResponse submitMovie(MovieSubmissionRequest request) {
        MovieSubmissionResponse response = restClient.post()
                .uri("/api/movies")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(MovieSubmissionResponse.class);
        if (response == null) {
            throw new IllegalStateException("Movie submission returned an empty response.");
        }
        return response;
    }

    @Override
    public Optional<MovieStatusResponse> getMovieStatus(String id, String token) {
        try {
            return Optional.ofNullable(restClient.get()
                    .uri("/api/movies/{id}/status?token={token}", id, token)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(MovieStatusResponse.class));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }
}
