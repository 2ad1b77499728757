package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Owns the on-disk layout under the storage root: {@code movies/<jobId>/frames} while a job
 * renders, {@code screenshots/<id>.png} for single frames.
 */
@Component
public class MovieWorkspace {

    private static final Logger logger = LoggerFactory.getLogger(MovieWorkspace.class);

    static final String MOVIES_DIRECTORY = "movies";
    static final String SCREENSHOTS_DIRECTORY = "screenshots";
    static final String FRAMES_DIRECTORY = "frames";
    static final String READY_MARKER = "READY";
    static final String THUMBNAIL_EXTENSION = ".png";

    private final Path storageRoot;
    private final String publicBaseUrl;

    public MovieWorkspace(MovieProperties properties) {
        this.storageRoot = properties.getStorage().getRoot().toAbsolutePath().normalize();
        String baseUrl = properties.getStorage().getPublicBaseUrl();
        this.publicBaseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public Path createJobDirectory(String jobId) throws IOException {
        Path jobDirectory = jobDirectory(jobId);
        Files.createDirectories(jobDirectory.resolve(FRAMES_DIRECTORY));
        return jobDirectory;
    }

    public Path jobDirectory(String jobId) {
        return storageRoot.resolve(MOVIES_DIRECTORY).resolve(jobId);
    }

    public Path framesDirectory(Path jobDirectory) {
        return jobDirectory.resolve(FRAMES_DIRECTORY);
    }

    public Path screenshotPath(String screenshotId) throws IOException {
        Path directory = storageRoot.resolve(SCREENSHOTS_DIRECTORY);
        Files.createDirectories(directory);
        return directory.resolve(screenshotId + THUMBNAIL_EXTENSION);
    }

    /**
     * Keeps the first frame as {@code <baseName>.png}, deletes every other frame together with the
     * frames directory and writes the {@code READY} marker.
     *
     * @return the thumbnail path
     */
    public Path finalizeMovie(Path jobDirectory, String baseName, List<Path> framePaths) throws IOException {
        if (framePaths.isEmpty()) {
            throw new IllegalStateException("Cannot finalize movie without frames.");
        }

        Path thumbnailPath = jobDirectory.resolve(baseName + THUMBNAIL_EXTENSION);
        Files.move(framePaths.get(0), thumbnailPath, StandardCopyOption.REPLACE_EXISTING);

        for (Path framePath : framePaths.subList(1, framePaths.size())) {
            Files.deleteIfExists(framePath);
        }
        deleteRecursively(framesDirectory(jobDirectory));

        Files.writeString(jobDirectory.resolve(READY_MARKER), "");
        return thumbnailPath;
    }

    /**
     * Removes everything a failed job left behind.
     */
    public void discard(Path jobDirectory) {
        if (jobDirectory == null) {
            return;
        }
        try {
            deleteRecursively(jobDirectory);
        } catch (IOException e) {
            // Cleanup failures are non-fatal.
            logger.debug("Could not remove job directory {}", jobDirectory, e);
        }
    }

    public String toPublicUrl(Path artifactPath) {
        if (artifactPath == null) {
            return null;
        }
        Path relative = storageRoot.relativize(artifactPath.toAbsolutePath().normalize());
        StringBuilder url = new StringBuilder(publicBaseUrl);
        for (Path segment : relative) {
            url.append('/').append(segment);
        }
        return url.toString();
    }

    private void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
