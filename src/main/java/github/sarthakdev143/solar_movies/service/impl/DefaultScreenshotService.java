package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.dto.ScreenshotRequest;
import github.sarthakdev143.solar_movies.dto.ScreenshotResponse;
import github.sarthakdev143.solar_movies.exception.NoImageAvailableException;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.Layer;
import github.sarthakdev143.solar_movies.model.MovieFrame;
import github.sarthakdev143.solar_movies.service.FrameCompositor;
import github.sarthakdev143.solar_movies.service.ScreenshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Service
public class DefaultScreenshotService implements ScreenshotService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultScreenshotService.class);

    private final MovieRequestValidator validator;
    private final FrameCompositor compositor;
    private final MovieWorkspace workspace;

    public DefaultScreenshotService(
            MovieRequestValidator validator,
            FrameCompositor compositor,
            MovieWorkspace workspace) {
        this.validator = validator;
        this.compositor = compositor;
        this.workspace = workspace;
    }

    @Override
    public ScreenshotResponse takeScreenshot(ScreenshotRequest request) throws IOException {
        if (request == null) {
            throw new IllegalArgumentException("request is required.");
        }

        List<Layer> layers = validator.normalizeLayers(request.layers()).stream()
                .filter(Layer::visible)
                .sorted(Comparator.comparingInt(Layer::layeringOrder))
                .toList();
        FrameGeometry geometry = validator.resolveGeometry(request.roi());
        if (request.date() == null) {
            throw new IllegalArgumentException("date is required.");
        }

        String screenshotId = UUID.randomUUID().toString();
        Path outputPath = workspace.screenshotPath(screenshotId);
        MovieFrame frame;
        try {
            frame = compositor.composite(request.date(), layers, geometry, outputPath);
        } catch (NoImageAvailableException e) {
            throw new IllegalArgumentException("No images available near " + request.date() + ".", e);
        }

        logger.info(
                "Created screenshot {} size={}x{} skippedSources={}",
                screenshotId,
                geometry.width(),
                geometry.height(),
                frame.skippedSourceIds());

        return new ScreenshotResponse(
                screenshotId,
                workspace.toPublicUrl(frame.compositePath()),
                geometry.width(),
                geometry.height(),
                frame.skippedSourceIds());
    }
}
