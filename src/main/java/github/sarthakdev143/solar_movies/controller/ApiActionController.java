package github.sarthakdev143.solar_movies.controller;

import github.sarthakdev143.solar_movies.dto.LayerRequest;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionResponse;
import github.sarthakdev143.solar_movies.dto.RegionOfInterestRequest;
import github.sarthakdev143.solar_movies.dto.ScreenshotRequest;
import github.sarthakdev143.solar_movies.model.ApiAction;
import github.sarthakdev143.solar_movies.model.MovieJobStatus;
import github.sarthakdev143.solar_movies.service.MovieService;
import github.sarthakdev143.solar_movies.service.ScreenshotService;
import github.sarthakdev143.solar_movies.service.impl.LayerStringParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Flat-parameter entry point: {@code /api?action=queueMovie&layers=[3,1,100]&x1=...}. The ROI is
 * given as {@code x1,x2} (left, right) and {@code y1,y2} (top, bottom) in arcseconds.
 */
@RestController
@RequestMapping("/api")
public class ApiActionController {

    private static final Logger logger = LoggerFactory.getLogger(ApiActionController.class);

    private final MovieService movieService;
    private final ScreenshotService screenshotService;
    private final LayerStringParser layerStringParser;

    public ApiActionController(
            MovieService movieService,
            ScreenshotService screenshotService,
            LayerStringParser layerStringParser) {
        this.movieService = movieService;
        this.screenshotService = screenshotService;
        this.layerStringParser = layerStringParser;
    }

    @RequestMapping(method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<?> dispatch(@RequestParam Map<String, String> params) {
        try {
            ApiAction action = ApiAction.fromInput(params.get("action"));
            return switch (action) {
                case QUEUE_MOVIE -> queueMovie(params);
                case GET_MOVIE_STATUS -> getMovieStatus(params);
                case TAKE_SCREENSHOT -> ResponseEntity.ok(screenshotService.takeScreenshot(new ScreenshotRequest(
                        parseLayers(params),
                        parseRoi(params),
                        parseInstant(params, "date"))));
            };
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (TaskRejectedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Movie queue is full. Please try again later.");
        } catch (Exception e) {
            logger.error("API action {} failed", params.get("action"), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Request failed. Please try again.");
        }
    }

    private ResponseEntity<?> queueMovie(Map<String, String> params) {
        MovieJobStatus job = movieService.submitMovie(new MovieSubmissionRequest(
                parseLayers(params),
                parseRoi(params),
                parseInstant(params, "startTime"),
                parseDouble(params, "frameRate"),
                parseInteger(params, "numFrames")));
        return ResponseEntity.accepted().body(new MovieSubmissionResponse(job.id(), job.token(), job.etaSeconds()));
    }

    private ResponseEntity<?> getMovieStatus(Map<String, String> params) {
        String id = requireParam(params, "id");
        return movieService.getMovieStatus(id, params.get("token"))
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Movie not found for id: " + id));
    }

    private List<LayerRequest> parseLayers(Map<String, String> params) {
        return layerStringParser.parse(requireParam(params, "layers"));
    }

    private RegionOfInterestRequest parseRoi(Map<String, String> params) {
        return new RegionOfInterestRequest(
                parseDouble(params, "y1"),
                parseDouble(params, "x1"),
                parseDouble(params, "y2"),
                parseDouble(params, "x2"),
                parseDouble(params, "imageScale"));
    }

    private Instant parseInstant(Map<String, String> params, String name) {
        String value = requireParam(params, name);
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be a valid ISO-8601 UTC instant.", e);
        }
    }

    private Double parseDouble(Map<String, String> params, String name) {
        String value = requireParam(params, name);
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number.", e);
        }
    }

    private Integer parseInteger(Map<String, String> params, String name) {
        String value = requireParam(params, name);
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer.", e);
        }
    }

    private String requireParam(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required.");
        }
        return value.trim();
    }
}
