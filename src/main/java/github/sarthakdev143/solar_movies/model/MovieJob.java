package github.sarthakdev143.solar_movies.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Server-side lifecycle of one movie request.
 *
 * <p>Allowed transitions are {@code QUEUED -> PROCESSING -> COMPLETED|ERROR} and
 * {@code QUEUED -> ERROR}. COMPLETED and ERROR are absorbing: every transition attempted from a
 * terminal state is refused and reported through the boolean return value, never thrown, so a
 * pipeline that finishes after the watchdog fired cannot resurrect the job.
 */
public class MovieJob {

    private static final Logger logger = LoggerFactory.getLogger(MovieJob.class);

    private final String id;
    private final String token;
    private final MovieRenderPlan plan;
    private final Instant dateRequested;
    private final long etaSeconds;

    private MovieJobState state = MovieJobState.QUEUED;
    private float progress;
    private Instant updatedAt;
    private MovieOutput output;
    private MovieErrorType errorType;

    public MovieJob(String id, String token, MovieRenderPlan plan, Instant dateRequested, long etaSeconds) {
        this.id = Objects.requireNonNull(id, "id");
        this.token = Objects.requireNonNull(token, "token");
        this.plan = Objects.requireNonNull(plan, "plan");
        this.dateRequested = Objects.requireNonNull(dateRequested, "dateRequested");
        this.etaSeconds = etaSeconds;
        this.updatedAt = dateRequested;
    }

    public String id() {
        return id;
    }

    public String token() {
        return token;
    }

    public MovieRenderPlan plan() {
        return plan;
    }

    public Instant dateRequested() {
        return dateRequested;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    public synchronized MovieJobState state() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized boolean markProcessing(Instant now) {
        if (state != MovieJobState.QUEUED) {
            return refuse(MovieJobState.PROCESSING);
        }
        state = MovieJobState.PROCESSING;
        updatedAt = now;
        return true;
    }

    public synchronized boolean updateProgress(float value, Instant now) {
        if (state != MovieJobState.PROCESSING) {
            return false;
        }
        float clamped = Math.max(0.0f, Math.min(1.0f, value));
        if (clamped < progress) {
            return false;
        }
        progress = clamped;
        updatedAt = now;
        return true;
    }

    public synchronized boolean markCompleted(MovieOutput movieOutput, Instant now) {
        Objects.requireNonNull(movieOutput, "movieOutput");
        if (state != MovieJobState.PROCESSING) {
            return refuse(MovieJobState.COMPLETED);
        }
        state = MovieJobState.COMPLETED;
        progress = 1.0f;
        output = movieOutput;
        updatedAt = now;
        return true;
    }

    public synchronized boolean markFailed(MovieErrorType type, Instant now) {
        Objects.requireNonNull(type, "type");
        if (state.isTerminal()) {
            return refuse(MovieJobState.ERROR);
        }
        state = MovieJobState.ERROR;
        errorType = type;
        updatedAt = now;
        return true;
    }

    /**
     * Moves a non-terminal job to ERROR once its age exceeds {@code ceiling}.
     *
     * @return {@code true} if this call expired the job
     */
    public synchronized boolean expireIfOlderThan(Duration ceiling, Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        if (Duration.between(dateRequested, now).compareTo(ceiling) <= 0) {
            return false;
        }
        return markFailed(MovieErrorType.TIMEOUT, now);
    }

    public synchronized MovieJobStatus snapshot() {
        return new MovieJobStatus(
                id,
                token,
                plan.name(),
                state,
                progress,
                dateRequested,
                updatedAt,
                etaSeconds,
                output,
                errorType);
    }

    private boolean refuse(MovieJobState target) {
        logger.warn("Refused transition of movie job {} from {} to {}", id, state, target);
        return false;
    }
}
