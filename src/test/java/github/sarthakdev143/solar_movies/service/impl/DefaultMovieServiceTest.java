package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.dto.LayerRequest;
import github.sarthakdev143.solar_movies.dto.MovieStatusResponse;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.dto.RegionOfInterestRequest;
import github.sarthakdev143.solar_movies.exception.EncodeException;
import github.sarthakdev143.solar_movies.exception.NoImageAvailableException;
import github.sarthakdev143.solar_movies.model.DataSource;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.ImageReference;
import github.sarthakdev143.solar_movies.model.Layer;
import github.sarthakdev143.solar_movies.model.MovieFormat;
import github.sarthakdev143.solar_movies.model.MovieFrame;
import github.sarthakdev143.solar_movies.model.MovieJobState;
import github.sarthakdev143.solar_movies.model.MovieJobStatus;
import github.sarthakdev143.solar_movies.service.DataSourceCatalog;
import github.sarthakdev143.solar_movies.service.FrameCompositor;
import github.sarthakdev143.solar_movies.service.MovieEncoder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultMovieServiceTest {

    private static final Instant START = Instant.parse("2011-06-07T06:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private MovieEncoder encoder;

    @TempDir
    Path storageRoot;

    private final ScriptedCompositor compositor = new ScriptedCompositor();
    private final MutableClock clock = new MutableClock(NOW);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<Runnable> deferredTasks = new ArrayList<>();
    private MovieProperties properties;
    private MovieJobRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new MovieProperties();
        properties.getStorage().setRoot(storageRoot);
        registry = new MovieJobRegistry();
    }

    @Test
    void submitMovieCompletesAndPublishesArtifacts() throws Exception {
        stubEncoderSuccess();
        DefaultMovieService service = service(Runnable::run);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(submitted.etaSeconds()).isEqualTo(9);
        assertThat(status.state()).isEqualTo(MovieJobState.COMPLETED);
        assertThat(status.numFrames()).isEqualTo(7);
        assertThat(status.frameRate()).isEqualTo(10.0);
        assertThat(status.startDate()).isEqualTo(START);
        assertThat(status.endDate()).isEqualTo(START.plusMillis(600));
        assertThat(status.width()).isEqualTo(800);
        assertThat(status.height()).isEqualTo(600);
        String base = "http://localhost:8080/files/movies/" + submitted.id() + "/2011_06_07_060000_AIA_171__LASCO_C2";
        assertThat(status.url()).isEqualTo(base + ".mp4");
        assertThat(status.thumbnailUrl()).isEqualTo(base + ".png");
        assertThat(status.formats()).containsEntry("mov", base + ".mov").containsEntry("flv", base + ".flv");

        Path jobDirectory = storageRoot.resolve("movies").resolve(submitted.id());
        assertThat(Files.exists(jobDirectory.resolve("READY"))).isTrue();
        assertThat(Files.exists(jobDirectory.resolve("frames"))).isFalse();
        assertThat(meterRegistry.counter("solar_movies.jobs.completed").count()).isEqualTo(1.0);
    }

    @Test
    void completedStatusIsIdenticalAcrossPolls() throws Exception {
        stubEncoderSuccess();
        DefaultMovieService service = service(Runnable::run);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse first = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();
        clock.advance(Duration.ofHours(30));
        MovieStatusResponse second = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void degradedFramesStillCompleteTheMovie() throws Exception {
        compositor.degradedFrames = Set.of(2, 5);
        stubEncoderSuccess();
        DefaultMovieService service = service(Runnable::run);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(status.state()).isEqualTo(MovieJobState.COMPLETED);
        assertThat(status.numFrames()).isEqualTo(7);
        assertThat(meterRegistry.counter("solar_movies.frames.degraded").count()).isEqualTo(2.0);
        verify(encoder).encode(anyList(), eq(10.0), any(FrameGeometry.class), any(Path.class), anyString());
    }

    @Test
    void encoderFailureMarksJobFailedWithGenericMessage() throws Exception {
        when(encoder.encode(anyList(), anyDouble(), any(FrameGeometry.class), any(Path.class), anyString()))
                .thenThrow(new EncodeException("encode mp4", 1, "FFmpeg failed for /srv/secret/frames with exit code 1"));
        DefaultMovieService service = service(Runnable::run);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(status.state()).isEqualTo(MovieJobState.ERROR);
        assertThat(status.error()).isEqualTo("Movie encoding failed.");
        assertThat(status.url()).isNull();
        assertThat(Files.exists(storageRoot.resolve("movies").resolve(submitted.id()))).isFalse();
        assertThat(meterRegistry.counter("solar_movies.jobs.failed", "reason", "encode_failed").count()).isEqualTo(1.0);
    }

    @Test
    void tooFewImagesMarksJobFailedAsInsufficientData() {
        compositor.unavailableFrames = Set.of(0, 1, 2, 3, 4, 5, 6);
        DefaultMovieService service = service(Runnable::run);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(status.state()).isEqualTo(MovieJobState.ERROR);
        assertThat(status.error()).isEqualTo("Not enough images for the requested time range.");
        verifyNoInteractions(encoder);
    }

    @Test
    void unexpectedFailureMarksJobFailedAsInternal() throws Exception {
        when(encoder.encode(anyList(), anyDouble(), any(FrameGeometry.class), any(Path.class), anyString()))
                .thenThrow(new IOException("disk full"));
        DefaultMovieService service = service(Runnable::run);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(status.error()).isEqualTo("Movie processing failed. Check server logs.");
    }

    @Test
    void submissionWithoutVisibleLayersIsRejectedBeforeQueueing() {
        DefaultMovieService service = service(Runnable::run);

        assertThatThrownBy(() -> service.submitMovie(new MovieSubmissionRequest(
                List.of(new LayerRequest(10, false, 100, null)),
                roi(),
                START,
                10.0,
                7)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.all()).isEmpty();
        assertThat(meterRegistry.counter("solar_movies.jobs.submitted").count()).isZero();
    }

    @Test
    void queuedJobReportsQueuedStatus() {
        DefaultMovieService service = service(deferredTasks::add);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(status.status()).isEqualTo(0);
        assertThat(status.progress()).isZero();
        assertThat(deferredTasks).hasSize(1);
    }

    @Test
    void statusRequiresMatchingToken() {
        DefaultMovieService service = service(deferredTasks::add);

        MovieJobStatus submitted = service.submitMovie(request(7));

        assertThat(service.getMovieStatus(submitted.id(), "wrong-token")).isEmpty();
        assertThat(service.getMovieStatus(submitted.id(), null)).isEmpty();
        assertThat(service.getMovieStatus("unknown", submitted.token())).isEmpty();
    }

    @Test
    void statusReadExpiresJobOlderThanCeiling() throws Exception {
        DefaultMovieService service = service(deferredTasks::add);
        MovieJobStatus submitted = service.submitMovie(request(7));

        clock.advance(Duration.ofHours(24).plusSeconds(1));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(status.state()).isEqualTo(MovieJobState.ERROR);
        assertThat(status.error()).isEqualTo("Movie generation timed out.");

        deferredTasks.forEach(Runnable::run);
        assertThat(service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow().state())
                .isEqualTo(MovieJobState.ERROR);
        verifyNoInteractions(encoder);
    }

    @Test
    void jobExpiringWhileRenderingIsAbortedAndNotResurrected() {
        compositor.onComposite = () -> clock.advance(Duration.ofHours(5));
        DefaultMovieService service = service(Runnable::run);

        MovieJobStatus submitted = service.submitMovie(request(7));
        MovieStatusResponse status = service.getMovieStatus(submitted.id(), submitted.token()).orElseThrow();

        assertThat(status.state()).isEqualTo(MovieJobState.ERROR);
        assertThat(status.error()).isEqualTo("Movie generation timed out.");
        assertThat(compositor.calls).isLessThan(7);
        verifyNoInteractions(encoder);
    }

    @Test
    void rejectedSubmissionLeavesNoJobBehind() {
        DefaultMovieService service = service(task -> {
            throw new TaskRejectedException("Worker queue is full");
        });

        assertThatThrownBy(() -> service.submitMovie(request(7)))
                .isInstanceOf(TaskRejectedException.class);

        assertThat(registry.all()).isEmpty();
        assertThat(meterRegistry.counter("solar_movies.jobs.submitted").count()).isZero();
        verifyNoInteractions(encoder);
    }

    @Test
    void estimateUsesConfiguredEtaModel() {
        properties.getEta().setSecondsPerFrame(2.0);
        properties.getEta().setEncodeOverheadSeconds(0.5);

        assertThat(service(Runnable::run).estimateSeconds(10)).isEqualTo(21);
    }

    private DefaultMovieService service(TaskExecutor executor) {
        DataSourceCatalog catalog = new StubCatalog();
        MovieRequestValidator validator = new MovieRequestValidator(
                catalog,
                new RegionOfInterestResolver(properties),
                properties);
        return new DefaultMovieService(
                validator,
                new FrameSequencer(compositor, properties, meterRegistry),
                encoder,
                new MovieWorkspace(properties),
                registry,
                properties,
                executor,
                meterRegistry,
                clock);
    }

    private void stubEncoderSuccess() throws Exception {
        when(encoder.encode(anyList(), anyDouble(), any(FrameGeometry.class), any(Path.class), anyString()))
                .thenAnswer(invocation -> {
                    Path directory = invocation.getArgument(3);
                    String baseName = invocation.getArgument(4);
                    Path mp4 = Files.writeString(directory.resolve(baseName + ".mp4"), "mp4");
                    Path mov = Files.writeString(directory.resolve(baseName + ".mov"), "mov");
                    Path flv = Files.writeString(directory.resolve(baseName + ".flv"), "flv");
                    return Map.of(MovieFormat.MP4, mp4, MovieFormat.MOV, mov, MovieFormat.FLV, flv);
                });
    }

    private MovieSubmissionRequest request(int numFrames) {
        return new MovieSubmissionRequest(
                List.of(new LayerRequest(10, true, 100, null), new LayerRequest(4, true, 70, null)),
                roi(),
                START,
                10.0,
                numFrames);
    }

    private RegionOfInterestRequest roi() {
        return new RegionOfInterestRequest(-300.0, -400.0, 300.0, 400.0, 1.0);
    }

    private static final class StubCatalog implements DataSourceCatalog {

        @Override
        public Optional<DataSource> findDataSource(int sourceId) {
            return switch (sourceId) {
                case 10 -> Optional.of(new DataSource(10, "AIA 171", 1));
                case 4 -> Optional.of(new DataSource(4, "LASCO C2", 2));
                default -> Optional.empty();
            };
        }

        @Override
        public Optional<ImageReference> findClosestImage(int sourceId, Instant timestamp) {
            return Optional.empty();
        }
    }

    private static final class ScriptedCompositor implements FrameCompositor {

        private Set<Integer> unavailableFrames = Set.of();
        private Set<Integer> degradedFrames = Set.of();
        private Runnable onComposite = () -> {
        };
        private int calls;

        @Override
        public MovieFrame composite(Instant timestamp, List<Layer> layers, FrameGeometry geometry, Path outputPath)
                throws NoImageAvailableException, IOException {
            int index = calls++;
            onComposite.run();
            if (unavailableFrames.contains(index)) {
                throw new NoImageAvailableException(List.of(10, 4), timestamp, "no images");
            }
            Files.writeString(outputPath, "frame-" + index);
            List<Integer> skipped = degradedFrames.contains(index) ? List.of(4) : List.of();
            return new MovieFrame(timestamp, Map.of(), outputPath, skipped);
        }
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
