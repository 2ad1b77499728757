package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.model.MovieErrorType;
import github.sarthakdev143.solar_movies.model.MovieJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Component
public class MovieJobWatchdog {

    private static final Logger logger = LoggerFactory.getLogger(MovieJobWatchdog.class);

    private final MovieJobRegistry registry;
    private final Duration ceiling;
    private final Duration retention;
    private final Clock clock;
    private final Counter timeoutCounter;

    public MovieJobWatchdog(
            MovieJobRegistry registry,
            MovieProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.ceiling = properties.getWatchdog().getCeiling();
        this.retention = properties.getWatchdog().getRetention();
        this.clock = clock;
        this.timeoutCounter = meterRegistry.counter(
                "solar_movies.jobs.failed",
                "reason",
                MovieErrorType.TIMEOUT.name().toLowerCase(Locale.ROOT));
    }

    @Scheduled(
            fixedDelayString = "${solar-movies.watchdog.sweep-interval:PT1M}",
            initialDelayString = "${solar-movies.watchdog.sweep-interval:PT1M}")
    public void sweep() {
        expireStaleJobs();
        evictFinishedJobs();
    }

    int expireStaleJobs() {
        List<MovieJob> expired = registry.expireStale(ceiling, clock.instant());
        for (MovieJob job : expired) {
            timeoutCounter.increment();
            logger.warn("Movie job {} exceeded the {} ceiling and was marked as failed", job.id(), ceiling);
        }
        return expired.size();
    }

    int evictFinishedJobs() {
        int evicted = registry.evictFinishedBefore(clock.instant().minus(retention));
        if (evicted > 0) {
            logger.info("Evicted {} finished movie jobs older than {}", evicted, retention);
        }
        return evicted;
    }
}
