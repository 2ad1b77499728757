package github.sarthakdev143.solar_movies.integration.catalog;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.model.DataSource;
import github.sarthakdev143.solar_movies.model.ImageReference;
import github.sarthakdev143.solar_movies.service.DataSourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads source images from {@code <catalog-root>/<sourceId>/yyyyMMdd_HHmmss.(png|jpg)}. Source
 * descriptors come from {@code solar-movies.catalog.sources}.
 */
@Component
public class FileSystemDataSourceCatalog implements DataSourceCatalog {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemDataSourceCatalog.class);
    private static final Pattern IMAGE_FILE_PATTERN = Pattern.compile(
            "^(\\d{8}_\\d{6})\\.(png|jpe?g)$",
            Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter OBSERVATION_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);

    private final Path root;
    private final Map<Integer, MovieProperties.Source> sources = new LinkedHashMap<>();

    public FileSystemDataSourceCatalog(MovieProperties properties) {
        this.root = properties.getCatalog().getRoot();
        for (MovieProperties.Source source : properties.getCatalog().getSources()) {
            if (sources.putIfAbsent(source.getId(), source) != null) {
                throw new IllegalStateException("Duplicate catalog source id: " + source.getId());
            }
        }
    }

    @Override
    public Optional<DataSource> findDataSource(int sourceId) {
        return Optional.ofNullable(sources.get(sourceId))
                .map(source -> new DataSource(
                        source.getId(),
                        source.getName() == null ? "source-" + source.getId() : source.getName(),
                        source.getLayeringOrder()));
    }

    @Override
    public Optional<ImageReference> findClosestImage(int sourceId, Instant timestamp) {
        MovieProperties.Source source = sources.get(sourceId);
        if (source == null) {
            return Optional.empty();
        }

        Path sourceDirectory = root.resolve(String.valueOf(sourceId));
        if (!Files.isDirectory(sourceDirectory)) {
            return Optional.empty();
        }

        Optional<Observation> closest;
        try (Stream<Path> files = Files.list(sourceDirectory)) {
            closest = files
                    .map(this::toObservation)
                    .flatMap(Optional::stream)
                    .min(Comparator
                            .comparing((Observation observation) -> Duration.between(observation.observedAt(), timestamp).abs())
                            .thenComparing(Observation::observedAt));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list images for source " + sourceId, e);
        }

        return closest.map(observation -> toReference(source, observation));
    }

    private Optional<Observation> toObservation(Path path) {
        Matcher matcher = IMAGE_FILE_PATTERN.matcher(path.getFileName().toString());
        if (!matcher.matches() || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            Instant observedAt = LocalDateTime.parse(matcher.group(1), OBSERVATION_TIME_FORMAT).toInstant(ZoneOffset.UTC);
            return Optional.of(new Observation(path, observedAt));
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring image with invalid timestamp {}", path);
            return Optional.empty();
        }
    }

    private ImageReference toReference(MovieProperties.Source source, Observation observation) {
        double sunCenterX;
        double sunCenterY;
        if (source.getSunCenterX() != null && source.getSunCenterY() != null) {
            sunCenterX = source.getSunCenterX();
            sunCenterY = source.getSunCenterY();
        } else {
            double[] center = imageCenter(observation.path());
            sunCenterX = center[0];
            sunCenterY = center[1];
        }
        return new ImageReference(
                source.getId(),
                observation.path(),
                observation.observedAt(),
                source.getImageScale(),
                sunCenterX,
                sunCenterY);
    }

    /**
     * Reads only the header to find the raster center. Unreadable files report the origin and are
     * rejected later by the compositor.
     */
    private double[] imageCenter(Path path) {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                return new double[]{0.0, 0.0};
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return new double[]{0.0, 0.0};
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input);
                return new double[]{reader.getWidth(0) / 2.0, reader.getHeight(0) / 2.0};
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            logger.debug("Could not read image header {}", path, e);
            return new double[]{0.0, 0.0};
        }
    }

    private record Observation(Path path, Instant observedAt) {
    }
}
