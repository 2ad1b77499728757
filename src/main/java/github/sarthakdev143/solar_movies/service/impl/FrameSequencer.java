package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.exception.InsufficientDataException;
import github.sarthakdev143.solar_movies.exception.NoImageAvailableException;
import github.sarthakdev143.solar_movies.model.FrameSequence;
import github.sarthakdev143.solar_movies.model.Layer;
import github.sarthakdev143.solar_movies.model.MovieFrame;
import github.sarthakdev143.solar_movies.model.MovieRenderPlan;
import github.sarthakdev143.solar_movies.service.FrameCompositor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

@Component
public class FrameSequencer {

    private static final Logger logger = LoggerFactory.getLogger(FrameSequencer.class);
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final FrameCompositor compositor;
    private final int minViableFrames;
    private final Counter degradedFramesCounter;
    private final Counter skippedFramesCounter;

    public FrameSequencer(FrameCompositor compositor, MovieProperties properties, MeterRegistry meterRegistry) {
        this.compositor = compositor;
        this.minViableFrames = properties.getFrames().getMinViable();
        this.degradedFramesCounter = meterRegistry.counter("solar_movies.frames.degraded");
        this.skippedFramesCounter = meterRegistry.counter("solar_movies.frames.skipped");
    }

    /**
     * Lazily yields {@code start + i / frameRate} for {@code i} in {@code [0, numFrames)}. The
     * iterator is single-use.
     */
    public Iterator<Instant> timestamps(Instant start, int numFrames, double frameRate) {
        if (start == null) {
            throw new IllegalArgumentException("start is required.");
        }
        if (numFrames < 1) {
            throw new IllegalArgumentException("numFrames must be at least 1.");
        }
        if (!Double.isFinite(frameRate) || frameRate <= 0.0) {
            throw new IllegalArgumentException("frameRate must be greater than 0.");
        }
        if ((numFrames - 1) * NANOS_PER_SECOND / frameRate >= Long.MAX_VALUE) {
            throw new IllegalArgumentException("frameRate " + frameRate + " is too low for " + numFrames + " frames.");
        }
        return new FrameTimeline(start, numFrames, frameRate);
    }

    public FrameSequence render(MovieRenderPlan plan, Path framesDirectory, ProgressListener progressListener)
            throws IOException {
        int numFrames = plan.numFrames();
        if (numFrames < minViableFrames) {
            throw new InsufficientDataException(0, minViableFrames);
        }

        List<Layer> layers = plan.visibleLayersBackToFront();
        List<MovieFrame> frames = new ArrayList<>();
        List<Instant> skippedTimestamps = new ArrayList<>();
        Iterator<Instant> timeline = timestamps(plan.startTime(), numFrames, plan.frameRate());

        int attempted = 0;
        while (timeline.hasNext()) {
            Instant timestamp = timeline.next();
            Path outputPath = framesDirectory.resolve(MovieFrame.fileName(frames.size()));
            try {
                MovieFrame frame = compositor.composite(timestamp, layers, plan.geometry(), outputPath);
                if (frame.degraded()) {
                    degradedFramesCounter.increment();
                    logger.info("Frame at {} composited without layers {}", timestamp, frame.skippedSourceIds());
                }
                frames.add(frame);
            } catch (NoImageAvailableException e) {
                skippedFramesCounter.increment();
                skippedTimestamps.add(timestamp);
                logger.info("Skipping frame at {}: {}", timestamp, e.getMessage());
            }
            attempted++;

            int remaining = numFrames - attempted;
            if (frames.size() + remaining < minViableFrames) {
                throw new InsufficientDataException(frames.size(), minViableFrames);
            }
            progressListener.onFrameCompleted(attempted, numFrames);
        }

        if (frames.size() < minViableFrames) {
            throw new InsufficientDataException(frames.size(), minViableFrames);
        }
        return new FrameSequence(frames, skippedTimestamps);
    }

    @FunctionalInterface
    public interface ProgressListener {

        /**
         * Called after each attempted timestamp. Throwing aborts the sequence.
         */
        void onFrameCompleted(int completedFrames, int totalFrames);
    }

    private static final class FrameTimeline implements Iterator<Instant> {

        private final Instant start;
        private final int numFrames;
        private final double frameRate;
        private int index;

        private FrameTimeline(Instant start, int numFrames, double frameRate) {
            this.start = start;
            this.numFrames = numFrames;
            this.frameRate = frameRate;
        }

        @Override
        public boolean hasNext() {
            return index < numFrames;
        }

        @Override
        public Instant next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Frame timeline exhausted after " + numFrames + " frames.");
            }
            long offsetNanos = Math.round(index * NANOS_PER_SECOND / frameRate);
            index++;
            return start.plusNanos(offsetNanos);
        }
    }
}
