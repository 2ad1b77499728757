package github.sarthakdev143.solar_movies.integration.image;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.exception.NoImageAvailableException;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.ImageReference;
import github.sarthakdev143.solar_movies.model.Layer;
import github.sarthakdev143.solar_movies.model.MovieFrame;
import github.sarthakdev143.solar_movies.model.RegionOfInterest;
import github.sarthakdev143.solar_movies.service.DataSourceCatalog;
import github.sarthakdev143.solar_movies.service.FrameCompositor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws every layer onto a black canvas in ascending layering order. A source pixel at
 * {@code (x, y)} lands on the canvas at {@code ((x - sunCenterX) * sourceScale - left) / frameScale}
 * horizontally, and likewise vertically with {@code top}.
 */
@Component
public class Java2dFrameCompositor implements FrameCompositor {

    private static final Logger logger = LoggerFactory.getLogger(Java2dFrameCompositor.class);
    private static final String OUTPUT_FORMAT = "png";

    private final DataSourceCatalog catalog;
    private final Duration searchTolerance;

    public Java2dFrameCompositor(DataSourceCatalog catalog, MovieProperties properties) {
        this.catalog = catalog;
        this.searchTolerance = properties.getFrames().getSearchTolerance();
    }

    @Override
    public MovieFrame composite(Instant timestamp, List<Layer> layers, FrameGeometry geometry, Path outputPath)
            throws NoImageAvailableException, IOException {
        List<Layer> orderedLayers = layers.stream()
                .filter(Layer::visible)
                .sorted(Comparator.comparingInt(Layer::layeringOrder))
                .toList();

        BufferedImage canvas = new BufferedImage(geometry.width(), geometry.height(), BufferedImage.TYPE_INT_RGB);
        Map<Integer, ImageReference> usedImages = new LinkedHashMap<>();
        List<Integer> skippedSourceIds = new ArrayList<>();

        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setColor(Color.BLACK);
            graphics.fillRect(0, 0, geometry.width(), geometry.height());
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);

            for (Layer layer : orderedLayers) {
                try {
                    ImageReference reference = resolveImage(layer.sourceId(), timestamp);
                    BufferedImage source = readImage(reference, timestamp);
                    graphics.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, layer.opacity() / 100.0f));
                    graphics.drawImage(source, placement(reference, geometry.roi()), null);
                    usedImages.put(layer.sourceId(), reference);
                } catch (NoImageAvailableException e) {
                    logger.debug("Skipping source {} at {}: {}", layer.sourceId(), timestamp, e.getMessage());
                    skippedSourceIds.add(layer.sourceId());
                }
            }
        } finally {
            graphics.dispose();
        }

        if (usedImages.isEmpty()) {
            throw new NoImageAvailableException(
                    skippedSourceIds,
                    timestamp,
                    "No layer has an image within " + searchTolerance + " of " + timestamp + ".");
        }

        Files.createDirectories(outputPath.toAbsolutePath().getParent());
        if (!ImageIO.write(canvas, OUTPUT_FORMAT, outputPath.toFile())) {
            throw new IOException("No PNG writer available for " + outputPath);
        }
        return new MovieFrame(timestamp, usedImages, outputPath, skippedSourceIds);
    }

    AffineTransform placement(ImageReference reference, RegionOfInterest roi) {
        double frameScale = roi.imageScale();
        double zoom = reference.imageScale() / frameScale;
        AffineTransform transform = new AffineTransform();
        transform.translate(-roi.left() / frameScale, -roi.top() / frameScale);
        transform.scale(zoom, zoom);
        transform.translate(-reference.sunCenterX(), -reference.sunCenterY());
        return transform;
    }

    private ImageReference resolveImage(int sourceId, Instant timestamp) throws NoImageAvailableException {
        ImageReference reference = catalog.findClosestImage(sourceId, timestamp)
                .orElseThrow(() -> new NoImageAvailableException(
                        List.of(sourceId),
                        timestamp,
                        "No image found for source " + sourceId + "."));

        Duration distance = Duration.between(reference.observedAt(), timestamp).abs();
        if (distance.compareTo(searchTolerance) > 0) {
            throw new NoImageAvailableException(
                    List.of(sourceId),
                    timestamp,
                    "Closest image for source " + sourceId + " is " + distance + " away.");
        }
        return reference;
    }

    private BufferedImage readImage(ImageReference reference, Instant timestamp) throws NoImageAvailableException {
        try {
            BufferedImage image = ImageIO.read(reference.path().toFile());
            if (image == null) {
                throw new NoImageAvailableException(
                        List.of(reference.sourceId()),
                        timestamp,
                        "Unsupported image format: " + reference.path().getFileName());
            }
            return image;
        } catch (IOException e) {
            throw new NoImageAvailableException(
                    List.of(reference.sourceId()),
                    timestamp,
                    "Unreadable image " + reference.path().getFileName() + ".",
                    e);
        }
    }
}
