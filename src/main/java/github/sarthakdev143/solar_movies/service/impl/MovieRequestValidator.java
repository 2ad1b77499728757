package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.dto.LayerRequest;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.dto.RegionOfInterestRequest;
import github.sarthakdev143.solar_movies.model.DataSource;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.Layer;
import github.sarthakdev143.solar_movies.model.MovieRenderPlan;
import github.sarthakdev143.solar_movies.model.RegionOfInterest;
import github.sarthakdev143.solar_movies.service.DataSourceCatalog;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class MovieRequestValidator {

    private static final int DEFAULT_OPACITY = 100;
    private static final int MIN_OPACITY = 0;
    private static final int MAX_OPACITY = 100;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;
    private static final DateTimeFormatter FILE_NAME_TIME_FORMAT = DateTimeFormatter
            .ofPattern("yyyy_MM_dd_HHmmss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final DataSourceCatalog catalog;
    private final RegionOfInterestResolver roiResolver;
    private final int maxFrames;
    private final double maxFrameRate;

    public MovieRequestValidator(
            DataSourceCatalog catalog,
            RegionOfInterestResolver roiResolver,
            MovieProperties properties) {
        this.catalog = catalog;
        this.roiResolver = roiResolver;
        this.maxFrames = properties.getFrames().getMaxFrames();
        this.maxFrameRate = properties.getFrames().getMaxFrameRate();
    }

    public MovieRenderPlan normalizeMovie(MovieSubmissionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required.");
        }

        List<Layer> layers = normalizeLayers(request.layers());
        FrameGeometry geometry = resolveGeometry(request.roi());

        if (request.startTime() == null) {
            throw new IllegalArgumentException("startTime is required.");
        }

        double frameRate = requireFrameRate(request.frameRate());
        int numFrames = requireNumFrames(request.numFrames());
        requireRepresentableSpan(request.startTime(), frameRate, numFrames);

        return new MovieRenderPlan(
                describe(layers),
                fileName(request.startTime(), layers),
                layers,
                geometry,
                request.startTime(),
                frameRate,
                numFrames);
    }

    public List<Layer> normalizeLayers(List<LayerRequest> layers) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("layers must contain at least one layer.");
        }

        List<Layer> normalized = new ArrayList<>();
        Set<Integer> seenSourceIds = new HashSet<>();

        for (int index = 0; index < layers.size(); index++) {
            LayerRequest layer = layers.get(index);
            if (layer == null) {
                throw new IllegalArgumentException("layers[" + index + "] must not be null.");
            }
            if (layer.sourceId() == null) {
                throw new IllegalArgumentException("layers[" + index + "].sourceId is required.");
            }

            int sourceId = layer.sourceId();
            if (!seenSourceIds.add(sourceId)) {
                throw new IllegalArgumentException("layers[" + index + "].sourceId " + sourceId + " is duplicated.");
            }

            DataSource dataSource = catalog.findDataSource(sourceId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown data source id: " + sourceId));

            int opacity = layer.opacity() == null ? DEFAULT_OPACITY : layer.opacity();
            if (opacity < MIN_OPACITY || opacity > MAX_OPACITY) {
                throw new IllegalArgumentException(
                        "layers[" + index + "].opacity must be between " + MIN_OPACITY + " and " + MAX_OPACITY + ".");
            }

            boolean visible = layer.visible() == null || layer.visible();
            int layeringOrder = layer.layeringOrder() == null ? dataSource.layeringOrder() : layer.layeringOrder();
            normalized.add(new Layer(sourceId, visible, opacity, layeringOrder));
        }

        if (normalized.stream().noneMatch(Layer::visible)) {
            throw new IllegalArgumentException("At least one layer must be visible.");
        }
        return normalized;
    }

    public FrameGeometry resolveGeometry(RegionOfInterestRequest roi) {
        if (roi == null) {
            throw new IllegalArgumentException("roi is required.");
        }
        return roiResolver.resolve(new RegionOfInterest(
                requireCoordinate(roi.top(), "roi.top"),
                requireCoordinate(roi.left(), "roi.left"),
                requireCoordinate(roi.bottom(), "roi.bottom"),
                requireCoordinate(roi.right(), "roi.right"),
                requireCoordinate(roi.imageScale(), "roi.imageScale")));
    }

    public String describe(List<Layer> layers) {
        return layers.stream()
                .filter(Layer::visible)
                .map(layer -> sourceName(layer.sourceId()))
                .collect(Collectors.joining(", "));
    }

    private String fileName(Instant startTime, List<Layer> layers) {
        String sources = layers.stream()
                .filter(Layer::visible)
                .map(layer -> sanitize(sourceName(layer.sourceId())))
                .collect(Collectors.joining("__"));
        return FILE_NAME_TIME_FORMAT.format(startTime) + "_" + sources;
    }

    private String sourceName(int sourceId) {
        return catalog.findDataSource(sourceId)
                .map(DataSource::name)
                .orElse("source-" + sourceId);
    }

    private String sanitize(String name) {
        String sanitized = name.trim().replaceAll("[^A-Za-z0-9-]+", "_");
        return sanitized.isEmpty() ? "layer" : sanitized;
    }

    private double requireFrameRate(Double frameRate) {
        if (frameRate == null || !Double.isFinite(frameRate)) {
            throw new IllegalArgumentException("frameRate must be a finite number.");
        }
        if (frameRate <= 0.0 || frameRate > maxFrameRate) {
            throw new IllegalArgumentException("frameRate must be greater than 0 and at most " + maxFrameRate + ".");
        }
        return frameRate;
    }

    private int requireNumFrames(Integer numFrames) {
        if (numFrames == null) {
            throw new IllegalArgumentException("numFrames is required.");
        }
        if (numFrames < 1 || numFrames > maxFrames) {
            throw new IllegalArgumentException("numFrames must be between 1 and " + maxFrames + ".");
        }
        return numFrames;
    }

    private void requireRepresentableSpan(Instant startTime, double frameRate, int numFrames) {
        double spanNanos = (numFrames - 1) * NANOS_PER_SECOND / frameRate;
        if (spanNanos >= Long.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "frameRate " + frameRate + " is too low for " + numFrames + " frames.");
        }
        try {
            startTime.plusNanos(Math.round(spanNanos));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("startTime plus the movie duration is out of range.", e);
        }
    }

    private double requireCoordinate(Double value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " is required.");
        }
        return value;
    }
}
