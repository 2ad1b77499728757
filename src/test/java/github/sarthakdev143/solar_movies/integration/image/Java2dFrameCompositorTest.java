package github.sarthakdev143.solar_movies.integration.image;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.exception.NoImageAvailableException;
import github.sarthakdev143.solar_movies.model.DataSource;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.ImageReference;
import github.sarthakdev143.solar_movies.model.Layer;
import github.sarthakdev143.solar_movies.model.MovieFrame;
import github.sarthakdev143.solar_movies.model.RegionOfInterest;
import github.sarthakdev143.solar_movies.service.DataSourceCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class Java2dFrameCompositorTest {

    private static final Instant TIMESTAMP = Instant.parse("2011-06-07T06:00:00Z");
    private static final FrameGeometry GEOMETRY = FrameGeometry.of(new RegionOfInterest(-50.0, -50.0, 50.0, 50.0, 1.0));

    @TempDir
    Path tempDir;

    private final MapCatalog catalog = new MapCatalog();
    private final Java2dFrameCompositor compositor = new Java2dFrameCompositor(catalog, new MovieProperties());

    @Test
    void compositeDrawsSingleLayerAlignedOnSunCenter() throws Exception {
        catalog.put(reference(10, solidImage("aia.png", Color.RED), TIMESTAMP));
        Path output = tempDir.resolve("frames").resolve("frame-00000.png");

        MovieFrame frame = compositor.composite(TIMESTAMP, List.of(new Layer(10, true, 100, 1)), GEOMETRY, output);

        assertThat(frame.compositePath()).isEqualTo(output);
        assertThat(frame.degraded()).isFalse();
        assertThat(frame.perLayerImageRef()).containsKey(10);
        BufferedImage written = ImageIO.read(output.toFile());
        assertThat(written.getWidth()).isEqualTo(100);
        assertThat(written.getHeight()).isEqualTo(100);
        assertThat(new Color(written.getRGB(50, 50))).isEqualTo(Color.RED);
    }

    @Test
    void compositeBlendsUpperLayerByOpacity() throws Exception {
        catalog.put(reference(10, solidImage("base.png", Color.BLUE), TIMESTAMP));
        catalog.put(reference(4, solidImage("top.png", Color.RED), TIMESTAMP));
        Path output = tempDir.resolve("blend.png");

        compositor.composite(
                TIMESTAMP,
                List.of(new Layer(4, true, 50, 2), new Layer(10, true, 100, 1)),
                GEOMETRY,
                output);

        Color pixel = new Color(ImageIO.read(output.toFile()).getRGB(50, 50));
        assertThat((double) pixel.getRed()).isCloseTo(127.5, within(2.0));
        assertThat((double) pixel.getBlue()).isCloseTo(127.5, within(2.0));
        assertThat(pixel.getGreen()).isZero();
    }

    @Test
    void compositeDrawsHigherLayeringOrderOnTop() throws Exception {
        catalog.put(reference(10, solidImage("lower.png", Color.BLUE), TIMESTAMP));
        catalog.put(reference(4, solidImage("upper.png", Color.GREEN), TIMESTAMP));
        Path output = tempDir.resolve("order.png");

        compositor.composite(
                TIMESTAMP,
                List.of(new Layer(4, true, 100, 5), new Layer(10, true, 100, 1)),
                GEOMETRY,
                output);

        assertThat(new Color(ImageIO.read(output.toFile()).getRGB(50, 50))).isEqualTo(Color.GREEN);
    }

    @Test
    void compositeSkipsLayerWithoutImage() throws Exception {
        catalog.put(reference(10, solidImage("aia.png", Color.RED), TIMESTAMP));
        Path output = tempDir.resolve("degraded.png");

        MovieFrame frame = compositor.composite(
                TIMESTAMP,
                List.of(new Layer(10, true, 100, 1), new Layer(4, true, 100, 2)),
                GEOMETRY,
                output);

        assertThat(frame.degraded()).isTrue();
        assertThat(frame.skippedSourceIds()).containsExactly(4);
        assertThat(Files.exists(output)).isTrue();
    }

    @Test
    void compositeSkipsImagesOutsideSearchTolerance() throws Exception {
        catalog.put(reference(10, solidImage("aia.png", Color.RED), TIMESTAMP));
        catalog.put(reference(4, solidImage("old.png", Color.RED), TIMESTAMP.minus(Duration.ofDays(2))));

        MovieFrame frame = compositor.composite(
                TIMESTAMP,
                List.of(new Layer(10, true, 100, 1), new Layer(4, true, 100, 2)),
                GEOMETRY,
                tempDir.resolve("tolerance.png"));

        assertThat(frame.skippedSourceIds()).containsExactly(4);
    }

    @Test
    void compositeSkipsUnreadableImages() throws Exception {
        Path broken = tempDir.resolve("broken.png");
        Files.writeString(broken, "not an image");
        catalog.put(reference(4, broken, TIMESTAMP));
        catalog.put(reference(10, solidImage("aia.png", Color.RED), TIMESTAMP));

        MovieFrame frame = compositor.composite(
                TIMESTAMP,
                List.of(new Layer(10, true, 100, 1), new Layer(4, true, 100, 2)),
                GEOMETRY,
                tempDir.resolve("unreadable.png"));

        assertThat(frame.skippedSourceIds()).containsExactly(4);
    }

    @Test
    void compositeFailsWhenEveryLayerIsMissing() {
        Path output = tempDir.resolve("missing.png");

        assertThatThrownBy(() -> compositor.composite(
                TIMESTAMP,
                List.of(new Layer(10, true, 100, 1), new Layer(4, true, 100, 2)),
                GEOMETRY,
                output))
                .isInstanceOf(NoImageAvailableException.class)
                .satisfies(e -> assertThat(((NoImageAvailableException) e).getSourceIds()).containsExactly(10, 4));
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void compositeScalesSourceByPlateScaleRatio() throws Exception {
        Path image = tempDir.resolve("quadrant.png");
        BufferedImage source = new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = source.createGraphics();
        graphics.setColor(Color.BLUE);
        graphics.fillRect(0, 0, 100, 100);
        graphics.setColor(Color.RED);
        graphics.fillRect(0, 0, 50, 100);
        graphics.dispose();
        ImageIO.write(source, "png", image.toFile());
        catalog.put(new ImageReference(10, image, TIMESTAMP, 2.0, 50.0, 50.0));
        Path output = tempDir.resolve("scaled.png");

        compositor.composite(TIMESTAMP, List.of(new Layer(10, true, 100, 1)), GEOMETRY, output);

        BufferedImage written = ImageIO.read(output.toFile());
        assertThat(new Color(written.getRGB(10, 50))).isEqualTo(Color.RED);
        assertThat(new Color(written.getRGB(90, 50))).isEqualTo(Color.BLUE);
    }

    private ImageReference reference(int sourceId, Path path, Instant observedAt) {
        return new ImageReference(sourceId, path, observedAt, 1.0, 50.0, 50.0);
    }

    private Path solidImage(String name, Color color) throws IOException {
        BufferedImage image = new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(color);
        graphics.fillRect(0, 0, 100, 100);
        graphics.dispose();
        Path path = tempDir.resolve(name);
        ImageIO.write(image, "png", path.toFile());
        return path;
    }

    private static final class MapCatalog implements DataSourceCatalog {

        private final Map<Integer, ImageReference> images = new HashMap<>();

        void put(ImageReference reference) {
            images.put(reference.sourceId(), reference);
        }

        @Override
        public Optional<DataSource> findDataSource(int sourceId) {
            return Optional.empty();
        }

        @Override
        public Optional<ImageReference> findClosestImage(int sourceId, Instant timestamp) {
            return Optional.ofNullable(images.get(sourceId));
        }
    }
}
