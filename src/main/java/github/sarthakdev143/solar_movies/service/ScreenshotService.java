package github.sarthakdev143.solar_movies.service;

import github.sarthakdev143.solar_movies.dto.ScreenshotRequest;
import github.sarthakdev143.solar_movies.dto.ScreenshotResponse;

import java.io.IOException;

public interface ScreenshotService {

    ScreenshotResponse takeScreenshot(ScreenshotRequest request) throws IOException;
}
