package github.sarthakdev143.solar_movies.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Viable frames of a movie in encode order plus the timestamps that produced no frame at all.
 */
public record FrameSequence(
        List<MovieFrame> frames,
        List<Instant> skippedTimestamps) {

    public FrameSequence {
        frames = frames == null ? List.of() : List.copyOf(frames);
        skippedTimestamps = skippedTimestamps == null ? List.of() : List.copyOf(skippedTimestamps);
    }

    public List<Path> framePaths() {
        return frames.stream().map(MovieFrame::compositePath).toList();
    }

    public int viableCount() {
        return frames.size();
    }

    public long degradedCount() {
        return frames.stream().filter(MovieFrame::degraded).count();
    }

    public Instant firstTimestamp() {
        return frames.isEmpty() ? null : frames.get(0).timestamp();
    }

    public Instant lastTimestamp() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1).timestamp();
    }
}
