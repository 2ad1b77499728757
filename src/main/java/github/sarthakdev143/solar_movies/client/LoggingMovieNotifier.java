package github.sarthakdev143.solar_movies.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingMovieNotifier implements MovieNotifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingMovieNotifier.class);

    @Override
    public void movieReady(MovieHistoryEntry entry) {
        logger.info("Your {} movie is ready! {}", entry.name(), entry.url());
    }

    @Override
    public void movieFailed(MovieHistoryEntry entry, String message) {
        logger.warn("Movie {} ({}): {}", entry.id(), entry.name(), message);
    }
}
