package github.sarthakdev143.solar_movies.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Movie history persisted as a JSON array. Every change rewrites the file through a temporary
 * sibling that is moved into place.
 */
public class JsonFileMovieHistory implements MovieHistory {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileMovieHistory.class);
    private static final TypeReference<List<MovieHistoryEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final int limit;
    private final List<MovieHistoryEntry> entries = new ArrayList<>();

    public JsonFileMovieHistory(Path file, ObjectMapper objectMapper, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be at least 1.");
        }
        this.file = file.toAbsolutePath();
        this.objectMapper = objectMapper;
        this.limit = limit;
        load();
    }

    @Override
    public synchronized void add(MovieHistoryEntry entry) {
        entries.removeIf(existing -> existing.id().equals(entry.id()));
        entries.add(0, entry);
        while (entries.size() > limit) {
            entries.remove(entries.size() - 1);
        }
        save();
    }

    @Override
    public synchronized Optional<MovieHistoryEntry> find(String id) {
        return entries.stream().filter(entry -> entry.id().equals(id)).findFirst();
    }

    @Override
    public synchronized void update(MovieHistoryEntry entry) {
        for (int index = 0; index < entries.size(); index++) {
            if (entries.get(index).id().equals(entry.id())) {
                entries.set(index, entry);
                save();
                return;
            }
        }
    }

    @Override
    public synchronized void remove(String id) {
        if (entries.removeIf(entry -> entry.id().equals(id))) {
            save();
        }
    }

    @Override
    public synchronized boolean has(String id) {
        return entries.stream().anyMatch(entry -> entry.id().equals(id));
    }

    @Override
    public synchronized List<MovieHistoryEntry> entries() {
        return List.copyOf(entries);
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try {
            List<MovieHistoryEntry> stored = objectMapper.readValue(file.toFile(), ENTRY_LIST);
            stored.stream().limit(limit).forEach(entries::add);
            logger.info("Loaded {} movie history entries from {}", entries.size(), file);
        } catch (IOException e) {
            logger.warn("Could not read movie history {}, starting empty", file, e);
        }
    }

    private void save() {
        try {
            Path directory = file.getParent();
            Files.createDirectories(directory);
            Path temporary = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temporary.toFile(), entries);
            Files.move(temporary, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            logger.warn("Could not write movie history {}", file, e);
        }
    }
}
