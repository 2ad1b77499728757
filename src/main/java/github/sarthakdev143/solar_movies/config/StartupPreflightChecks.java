package github.sarthakdev143.solar_movies.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "solar-movies.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final MovieProperties properties;

    public StartupPreflightChecks(MovieProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegConfiguration();
        checkStorageConfiguration();
    }

    private void checkFfmpegConfiguration() {
        String ffmpegBinary = properties.getEncoder().getFfmpegPath();
        if (ffmpegBinary == null || ffmpegBinary.isBlank()) {
            throw new IllegalStateException("solar-movies.encoder.ffmpeg-path must not be blank.");
        }

        try {
            Process process = new ProcessBuilder(ffmpegBinary, "-version")
                    .redirectErrorStream(true)
                    .start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not usable at '" + ffmpegBinary + "'. Install FFmpeg or set FFMPEG_PATH.");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not usable at '" + ffmpegBinary + "'. Install FFmpeg or set FFMPEG_PATH.",
                    e);
        }
    }

    private void checkStorageConfiguration() {
        Path storageRoot = properties.getStorage().getRoot();
        try {
            Files.createDirectories(storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Movie storage root could not be created at " + storageRoot.toAbsolutePath() + ".",
                    e);
        }

        if (!Files.isWritable(storageRoot)) {
            throw new IllegalStateException(
                    "Movie storage root is not writable at " + storageRoot.toAbsolutePath() + ".");
        }
    }
}
