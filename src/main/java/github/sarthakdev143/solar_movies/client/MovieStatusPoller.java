package github.sarthakdev143.solar_movies.client;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.dto.MovieStatusResponse;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionRequest;
import github.sarthakdev143.solar_movies.dto.MovieSubmissionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Follows submitted movies until they finish. Each job has at most one pending query; the next one
 * is scheduled only after the previous response was handled.
 */
public class MovieStatusPoller {

    private static final Logger logger = LoggerFactory.getLogger(MovieStatusPoller.class);

    public static final String FAILURE_MESSAGE = "Sorry, we were unable to create the movie you requested. "
            + "This usually means that there are not enough images for the time range requested. "
            + "Please try adjusting the observation date or movie duration and try creating a new movie.";

    private final MovieApiClient apiClient;
    private final MovieHistory history;
    private final MovieNotifier notifier;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration minimumFirstPollDelay;
    private final Duration pollInterval;
    private final Duration abandonAfter;
    private final Map<String, ScheduledFuture<?>> scheduledPolls = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> stopRequested = ConcurrentHashMap.newKeySet();

    public MovieStatusPoller(
            MovieApiClient apiClient,
            MovieHistory history,
            MovieNotifier notifier,
            TaskScheduler taskScheduler,
            Clock clock,
            MovieProperties.Client settings) {
        this.apiClient = apiClient;
        this.history = history;
        this.notifier = notifier;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.minimumFirstPollDelay = settings.getMinimumFirstPollDelay();
        this.pollInterval = settings.getPollInterval();
        this.abandonAfter = settings.getAbandonAfter();
    }

    public MovieHistoryEntry submit(MovieSubmissionRequest request, String name) {
        return queue(apiClient.submitMovie(request), name);
    }

    public MovieHistoryEntry queue(MovieSubmissionResponse response, String name) {
        Instant now = clock.instant();
        MovieHistoryEntry entry = MovieHistoryEntry.queued(response.id(), response.token(), name, now);
        history.add(entry);

        Duration eta = Duration.ofSeconds(Math.max(response.eta(), 0L));
        Duration firstDelay = eta.compareTo(minimumFirstPollDelay) > 0 ? eta : minimumFirstPollDelay;
        schedule(entry.id(), now.plus(firstDelay));
        logger.info("Queued movie {} ({}), first status check in {}", entry.id(), name, firstDelay);
        return entry;
    }

    /**
     * Restarts monitoring for every unfinished history entry, e.g. after a restart.
     */
    public int resumeAll() {
        int resumed = 0;
        Instant now = clock.instant();
        for (MovieHistoryEntry entry : history.entries()) {
            if (!entry.isTerminal() && !isMonitoring(entry.id())) {
                schedule(entry.id(), now);
                resumed++;
            }
        }
        if (resumed > 0) {
            logger.info("Resumed monitoring of {} movies", resumed);
        }
        return resumed;
    }

    /**
     * True while a query for {@code id} is scheduled or in flight.
     */
    public boolean isMonitoring(String id) {
        return scheduledPolls.containsKey(id) || inFlight.contains(id);
    }

    /**
     * Cancels the pending query. A query already in flight completes but schedules no successor.
     */
    public void stop(String id) {
        if (inFlight.contains(id)) {
            stopRequested.add(id);
        }
        ScheduledFuture<?> pending = scheduledPolls.remove(id);
        if (pending != null) {
            pending.cancel(false);
        }
    }

    public void stopAll() {
        inFlight.forEach(stopRequested::add);
        scheduledPolls.keySet().forEach(this::stop);
    }

    void poll(String id) {
        if (!inFlight.add(id)) {
            logger.debug("Status query for movie {} already in flight", id);
            return;
        }
        scheduledPolls.remove(id);
        try {
            pollOnce(id);
        } finally {
            stopRequested.remove(id);
            inFlight.remove(id);
        }
    }

    private void pollOnce(String id) {
        Optional<MovieHistoryEntry> current = history.find(id);
        if (current.isEmpty()) {
            logger.debug("Movie {} was removed from history, no longer monitoring", id);
            return;
        }
        MovieHistoryEntry entry = current.get();
        if (entry.isTerminal()) {
            return;
        }

        if (Duration.between(entry.dateRequested(), clock.instant()).compareTo(abandonAfter) > 0) {
            logger.warn("Movie {} did not finish within {}, giving up", id, abandonAfter);
            abort(entry);
            return;
        }

        Optional<MovieStatusResponse> status;
        try {
            status = apiClient.getMovieStatus(id, entry.token());
        } catch (RuntimeException e) {
            logger.warn("Status query for movie {} failed, retrying in {}", id, pollInterval, e);
            schedule(id, clock.instant().plus(pollInterval));
            return;
        }

        if (!history.has(id)) {
            logger.debug("Movie {} was removed from history while its status was being queried", id);
            return;
        }
        if (status.isEmpty()) {
            logger.warn("Movie {} is unknown to the server", id);
            abort(entry);
            return;
        }

        MovieStatusResponse response = status.get();
        switch (response.state()) {
            case COMPLETED -> {
                MovieHistoryEntry completed = entry.completed(response);
                history.update(completed);
                notifier.movieReady(completed);
            }
            case ERROR -> {
                logger.warn("Movie {} failed on the server: {}", id, response.error());
                abort(entry);
            }
            case QUEUED, PROCESSING -> {
                history.update(entry.withProgress(response.state(), response.progress()));
                schedule(id, clock.instant().plus(pollInterval));
            }
        }
    }

    private void abort(MovieHistoryEntry entry) {
        MovieHistoryEntry failed = entry.failed();
        history.update(failed);
        notifier.movieFailed(failed, FAILURE_MESSAGE);
    }

    private void schedule(String id, Instant when) {
        if (stopRequested.contains(id)) {
            logger.debug("Monitoring of movie {} was stopped, not scheduling another query", id);
            return;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> poll(id), when);
        ScheduledFuture<?> previous = scheduledPolls.put(id, future);
        if (previous != null && previous != future) {
            previous.cancel(false);
        }
    }
}
