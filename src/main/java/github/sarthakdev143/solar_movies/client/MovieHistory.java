package github.sarthakdev143.solar_movies.client;

import java.util.List;
import java.util.Optional;

/**
 * Local movie history, newest first.
 */
public interface MovieHistory {

    void add(MovieHistoryEntry entry);

    Optional<MovieHistoryEntry> find(String id);

    /**
     * Replaces the entry with the same id. Does nothing if the entry was removed meanwhile.
     */
    void update(MovieHistoryEntry entry);

    void remove(String id);

    boolean has(String id);

    List<MovieHistoryEntry> entries();
}
