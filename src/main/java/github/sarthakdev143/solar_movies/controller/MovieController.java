package github.sarthakdev143.solar_movies.controller;

import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionResponse;
import github.sarthakdev143.solar_movies.model.MovieJobStatus;
import github.sarthakdev143.solar_movies.service.MovieService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/movies")
public class MovieController {

    private static final Logger logger = LoggerFactory.getLogger(MovieController.class);

    private final MovieService movieService;

    public MovieController(MovieService movieService) {
        this.movieService = movieService;
    }

    @PostMapping(consumes = "application/json")
    public ResponseEntity<?> queueMovie(@RequestBody MovieSubmissionRequest request) {
        try {
            MovieJobStatus job = movieService.submitMovie(request);
            return ResponseEntity.accepted()
                    .body(new MovieSubmissionResponse(job.id(), job.token(), job.etaSeconds()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (TaskRejectedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Movie queue is full. Please try again later.");
        } catch (Exception e) {
            logger.error("Movie submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to queue movie. Please try again.");
        }
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<?> getMovieStatus(
            @PathVariable String id,
            @RequestParam(value = "token", required = false) String token) {
        return movieService.getMovieStatus(id, token)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Movie not found for id: " + id));
    }
}
