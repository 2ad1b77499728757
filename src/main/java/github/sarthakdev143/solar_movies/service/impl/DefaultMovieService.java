package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.config.ExecutorConfig;
import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.dto.MovieStatusResponse;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.exception.JobTimeoutException;
import github.sarthakdev143.solar_movies.exception.MovieGenerationException;
import github.sarthakdev143.solar_movies.model.FrameSequence;
import github.sarthakdev143.solar_movies.model.MovieErrorType;
import github.sarthakdev143.solar_movies.model.MovieFormat;
import github.sarthakdev143.solar_movies.model.MovieJob;
import github.sarthakdev143.solar_movies.model.MovieJobStatus;
import github.sarthakdev143.solar_movies.model.MovieOutput;
import github.sarthakdev143.solar_movies.model.MovieRenderPlan;
import github.sarthakdev143.solar_movies.service.MovieEncoder;
import github.sarthakdev143.solar_movies.service.MovieService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class DefaultMovieService implements MovieService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMovieService.class);

    private final MovieRequestValidator validator;
    private final FrameSequencer sequencer;
    private final MovieEncoder encoder;
    private final MovieWorkspace workspace;
    private final MovieJobRegistry registry;
    private final TaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration watchdogCeiling;
    private final double secondsPerFrame;
    private final double encodeOverheadSeconds;
    private final Counter jobsSubmittedCounter;
    private final Counter jobsCompletedCounter;

    public DefaultMovieService(
            MovieRequestValidator validator,
            FrameSequencer sequencer,
            MovieEncoder encoder,
            MovieWorkspace workspace,
            MovieJobRegistry registry,
            MovieProperties properties,
            @Qualifier(ExecutorConfig.MOVIE_JOB_EXECUTOR) TaskExecutor taskExecutor,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.validator = validator;
        this.sequencer = sequencer;
        this.encoder = encoder;
        this.workspace = workspace;
        this.registry = registry;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.watchdogCeiling = properties.getWatchdog().getCeiling();
        this.secondsPerFrame = properties.getEta().getSecondsPerFrame();
        this.encodeOverheadSeconds = properties.getEta().getEncodeOverheadSeconds();
        this.jobsSubmittedCounter = meterRegistry.counter("solar_movies.jobs.submitted");
        this.jobsCompletedCounter = meterRegistry.counter("solar_movies.jobs.completed");
    }

    @Override
    public MovieJobStatus submitMovie(MovieSubmissionRequest request) {
        MovieRenderPlan plan = validator.normalizeMovie(request);

        String jobId = UUID.randomUUID().toString();
        String token = UUID.randomUUID().toString();
        long etaSeconds = estimateSeconds(plan.numFrames());
        MovieJob job = new MovieJob(jobId, token, plan, clock.instant(), etaSeconds);
        registry.register(job);
        try {
            taskExecutor.execute(() -> processJob(job));
        } catch (TaskRejectedException e) {
            registry.remove(jobId);
            logger.warn("Movie job {} rejected, worker queue is full", jobId);
            throw e;
        }
        jobsSubmittedCounter.increment();

        logger.info(
                "Accepted movie job {} name=\"{}\" numFrames={} frameRate={} size={}x{} eta={}s",
                jobId,
                plan.name(),
                plan.numFrames(),
                plan.frameRate(),
                plan.geometry().width(),
                plan.geometry().height(),
                etaSeconds);
        return job.snapshot();
    }

    @Override
    public Optional<MovieStatusResponse> getMovieStatus(String id, String token) {
        return registry.find(id)
                .filter(job -> tokenMatches(job.token(), token))
                .map(job -> {
                    if (job.expireIfOlderThan(watchdogCeiling, clock.instant())) {
                        failureCounter(MovieErrorType.TIMEOUT).increment();
                        logger.warn("Movie job {} exceeded the {} ceiling and was marked as failed", id, watchdogCeiling);
                    }
                    return toStatusResponse(job.snapshot());
                });
    }

    long estimateSeconds(int numFrames) {
        return (long) Math.ceil(numFrames * secondsPerFrame + encodeOverheadSeconds);
    }

    private void processJob(MovieJob job) {
        String jobId = job.id();
        if (!job.markProcessing(clock.instant())) {
            logger.warn("Movie job {} was no longer queued when its worker started", jobId);
            return;
        }

        MovieRenderPlan plan = job.plan();
        Path jobDirectory = null;
        try {
            jobDirectory = workspace.createJobDirectory(jobId);
            FrameSequence sequence = sequencer.render(
                    plan,
                    workspace.framesDirectory(jobDirectory),
                    (completed, total) -> reportProgress(job, completed, total));

            abortIfTerminated(job);
            Map<MovieFormat, Path> outputPaths = encoder.encode(
                    sequence.framePaths(),
                    plan.frameRate(),
                    plan.geometry(),
                    jobDirectory,
                    plan.fileName());
            Path thumbnailPath = workspace.finalizeMovie(jobDirectory, plan.fileName(), sequence.framePaths());

            MovieOutput output = new MovieOutput(
                    plan.frameRate(),
                    sequence.viableCount(),
                    sequence.firstTimestamp(),
                    sequence.lastTimestamp(),
                    plan.geometry().width(),
                    plan.geometry().height(),
                    thumbnailPath,
                    outputPaths);

            if (!job.markCompleted(output, clock.instant())) {
                workspace.discard(jobDirectory);
                return;
            }
            jobsCompletedCounter.increment();
            logger.info(
                    "Completed movie job {} numFrames={} degradedFrames={} skippedFrames={}",
                    jobId,
                    sequence.viableCount(),
                    sequence.degradedCount(),
                    sequence.skippedTimestamps().size());
        } catch (MovieGenerationException e) {
            logger.error("Movie job {} failed: {}", jobId, e.getMessage(), e);
            fail(job, e.errorType(), jobDirectory);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Movie job {} was interrupted", jobId, e);
            fail(job, MovieErrorType.INTERNAL, jobDirectory);
        } catch (Exception e) {
            logger.error("Movie job {} failed", jobId, e);
            fail(job, MovieErrorType.INTERNAL, jobDirectory);
        }
    }

    private void reportProgress(MovieJob job, int completedFrames, int totalFrames) {
        abortIfTerminated(job);
        job.updateProgress((float) completedFrames / totalFrames, clock.instant());
    }

    private void abortIfTerminated(MovieJob job) {
        if (job.expireIfOlderThan(watchdogCeiling, clock.instant())) {
            failureCounter(MovieErrorType.TIMEOUT).increment();
        }
        if (job.isTerminal()) {
            throw new JobTimeoutException(job.id(), watchdogCeiling);
        }
    }

    private void fail(MovieJob job, MovieErrorType errorType, Path jobDirectory) {
        if (job.markFailed(errorType, clock.instant())) {
            failureCounter(errorType).increment();
        }
        workspace.discard(jobDirectory);
    }

    private Counter failureCounter(MovieErrorType errorType) {
        return meterRegistry.counter("solar_movies.jobs.failed", "reason", errorType.name().toLowerCase(Locale.ROOT));
    }

    private MovieStatusResponse toStatusResponse(MovieJobStatus status) {
        return switch (status.state()) {
            case QUEUED, PROCESSING -> MovieStatusResponse.pending(status.state(), status.progress());
            case ERROR -> MovieStatusResponse.failed(status.errorMessage());
            case COMPLETED -> {
                MovieOutput output = status.output();
                Map<String, String> formats = new LinkedHashMap<>();
                for (MovieFormat format : MovieFormat.values()) {
                    Path path = output.outputPaths().get(format);
                    if (path != null) {
                        formats.put(format.extension(), workspace.toPublicUrl(path));
                    }
                }
                yield MovieStatusResponse.completed(
                        output.frameRate(),
                        output.numFrames(),
                        output.startDate(),
                        output.endDate(),
                        output.width(),
                        output.height(),
                        workspace.toPublicUrl(output.thumbnailPath()),
                        workspace.toPublicUrl(output.primaryPath()),
                        formats);
            }
        };
    }

    private boolean tokenMatches(String expected, String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
