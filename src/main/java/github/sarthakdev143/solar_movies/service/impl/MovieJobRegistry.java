package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.model.MovieJob;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class MovieJobRegistry {

    private final Map<String, MovieJob> jobs = new ConcurrentHashMap<>();

    public void register(MovieJob job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Movie job " + job.id() + " is already registered.");
        }
    }

    public Optional<MovieJob> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    public void remove(String jobId) {
        jobs.remove(jobId);
    }

    public Collection<MovieJob> all() {
        return List.copyOf(jobs.values());
    }

    /**
     * Forgets COMPLETED and ERROR jobs whose last transition happened before {@code cutoff}.
     *
     * @return number of evicted jobs
     */
    public int evictFinishedBefore(Instant cutoff) {
        int evicted = 0;
        for (MovieJob job : jobs.values()) {
            if (job.isTerminal() && job.updatedAt().isBefore(cutoff) && jobs.remove(job.id(), job)) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * @return jobs this sweep moved to ERROR
     */
    public List<MovieJob> expireStale(Duration ceiling, Instant now) {
        List<MovieJob> expired = new ArrayList<>();
        for (MovieJob job : jobs.values()) {
            if (job.expireIfOlderThan(ceiling, now)) {
                expired.add(job);
            }
        }
        return expired;
    }
}
