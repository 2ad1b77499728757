package github.sarthakdev143.solar_movies.integration.video;

import github.sarthakdev143.solar_movies.config.ExecutorConfig;
import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.exception.EncodeException;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.MovieFormat;
import github.sarthakdev143.solar_movies.model.MovieFrame;
import github.sarthakdev143.solar_movies.service.MovieEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegMovieEncoder implements MovieEncoder {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegMovieEncoder.class);
    private static final int MAX_OUTPUT_TAIL_CHARS = 2000;
    private static final int PROCESS_KILL_GRACE_SECONDS = 5;

    private final String ffmpegBinary;
    private final Duration timeout;
    private final String preset;
    private final int crf;
    private final Executor encoderExecutor;

    public FfmpegMovieEncoder(
            MovieProperties properties,
            @Qualifier(ExecutorConfig.ENCODER_EXECUTOR) Executor encoderExecutor) {
        this.ffmpegBinary = properties.getEncoder().getFfmpegPath();
        this.timeout = properties.getEncoder().getTimeout();
        this.preset = properties.getEncoder().getPreset();
        this.crf = properties.getEncoder().getCrf();
        this.encoderExecutor = encoderExecutor;
    }

    @Override
    public Map<MovieFormat, Path> encode(
            List<Path> framePaths,
            double frameRate,
            FrameGeometry geometry,
            Path outputDirectory,
            String baseName) throws IOException, InterruptedException {
        Path framesDirectory = requireContiguousFrames(framePaths);

        Path primaryPath = outputDirectory.resolve(baseName + "." + MovieFormat.MP4.extension());
        runCommand(
                buildPrimaryCommand(framesDirectory, framePaths.size(), frameRate, geometry, primaryPath),
                "encode " + MovieFormat.MP4.extension());

        Map<MovieFormat, Path> outputs = new EnumMap<>(MovieFormat.class);
        outputs.put(MovieFormat.MP4, primaryPath);

        Map<MovieFormat, CompletableFuture<Path>> derivedRuns = new EnumMap<>(MovieFormat.class);
        for (MovieFormat format : MovieFormat.derived()) {
            Path targetPath = outputDirectory.resolve(baseName + "." + format.extension());
            derivedRuns.put(format, CompletableFuture.supplyAsync(
                    () -> remux(primaryPath, format, targetPath),
                    encoderExecutor));
        }

        try {
            CompletableFuture.allOf(derivedRuns.values().toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
        derivedRuns.forEach((format, run) -> outputs.put(format, run.join()));
        return outputs;
    }

    List<String> buildPrimaryCommand(
            Path framesDirectory,
            int frameCount,
            double frameRate,
            FrameGeometry geometry,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        command.add("-framerate");
        command.add(formatDecimal(frameRate));
        command.add("-start_number");
        command.add("0");
        command.add("-i");
        command.add(framesDirectory.resolve(MovieFrame.FILE_NAME_PATTERN).toString());
        command.add("-frames:v");
        command.add(String.valueOf(frameCount));
        command.add("-vf");
        command.add(buildScaleFilter(geometry.width(), geometry.height()));
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add(preset);
        command.add("-crf");
        command.add(String.valueOf(crf));
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-movflags");
        command.add("+faststart");
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildRemuxCommand(Path primaryPath, MovieFormat format, Path outputPath) {
        return List.of(
                ffmpegBinary,
                "-y",
                "-i",
                primaryPath.toString(),
                "-c",
                "copy",
                "-f",
                format.muxer(),
                outputPath.toString());
    }

    String buildScaleFilter(int width, int height) {
        return "scale="
                + width
                + ":"
                + height
                + ":force_original_aspect_ratio=decrease,pad="
                + width
                + ":"
                + height
                + ":(ow-iw)/2:(oh-ih)/2:black,setsar=1";
    }

    private Path remux(Path primaryPath, MovieFormat format, Path targetPath) {
        try {
            runCommand(buildRemuxCommand(primaryPath, format, targetPath), "remux " + format.extension());
            return targetPath;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EncodeException("remux " + format.extension(), "Interrupted while remuxing.", e);
        }
    }

    private Path requireContiguousFrames(List<Path> framePaths) {
        if (framePaths == null || framePaths.isEmpty()) {
            throw new IllegalArgumentException("At least one frame is required to encode a movie.");
        }
        Path framesDirectory = framePaths.get(0).toAbsolutePath().getParent();
        for (int index = 0; index < framePaths.size(); index++) {
            Path framePath = framePaths.get(index).toAbsolutePath();
            if (!framePath.getParent().equals(framesDirectory)
                    || !framePath.getFileName().toString().equals(MovieFrame.fileName(index))) {
                throw new IllegalArgumentException(
                        "Frame " + index + " must be " + MovieFrame.fileName(index) + " in " + framesDirectory + ".");
            }
        }
        return framesDirectory;
    }

    private IOException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof EncodeException encodeException) {
            throw encodeException;
        }
        if (cause instanceof UncheckedIOException uncheckedIOException) {
            return uncheckedIOException.getCause();
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        return new IOException("Derived container encoding failed.", cause);
    }

    private void runCommand(List<String> command, String stage) throws IOException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Path log = Files.createTempFile("ffmpeg-", ".log");
        try {
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .redirectErrorStream(true)
                        .redirectOutput(log.toFile())
                        .start();
            } catch (IOException e) {
                throw new EncodeException(stage, "Could not start FFmpeg for stage " + stage + ".", e);
            }

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(PROCESS_KILL_GRACE_SECONDS, TimeUnit.SECONDS);
                throw new EncodeException(stage, null, "FFmpeg timed out after " + timeout + " during stage: " + stage);
            }

            if (process.exitValue() != 0) {
                throw new EncodeException(
                        stage,
                        process.exitValue(),
                        "FFmpeg failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + tail(log));
            }
        } finally {
            deleteLog(log);
        }
    }

    private String tail(Path log) throws IOException {
        String output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
        if (output.length() <= MAX_OUTPUT_TAIL_CHARS) {
            return output;
        }
        return output.substring(output.length() - MAX_OUTPUT_TAIL_CHARS);
    }

    private void deleteLog(Path log) {
        try {
            Files.deleteIfExists(log);
        } catch (IOException e) {
            // Cleanup failures are non-fatal.
            logger.debug("Could not remove FFmpeg log {}", log, e);
        }
    }

    private String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
