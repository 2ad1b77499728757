package github.sarthakdev143.solar_movies.integration.video;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.exception.EncodeException;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.MovieErrorType;
import github.sarthakdev143.solar_movies.model.MovieFormat;
import github.sarthakdev143.solar_movies.model.RegionOfInterest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegMovieEncoderTest {

    private static final FrameGeometry GEOMETRY = FrameGeometry.of(new RegionOfInterest(-540.0, -960.0, 540.0, 960.0, 1.0));

    @TempDir
    Path tempDir;

    private final FfmpegMovieEncoder encoder = new FfmpegMovieEncoder(new MovieProperties(), Runnable::run);

    @Test
    void buildPrimaryCommandEncodesNumberedFramesAsH264() {
        Path framesDir = Path.of("work", "frames");

        List<String> command = encoder.buildPrimaryCommand(framesDir, 7, 10.0, GEOMETRY, Path.of("work", "movie.mp4"));

        assertThat(command.get(0)).isEqualTo("ffmpeg");
        assertThat(command).containsSequence("-framerate", "10.000");
        assertThat(command).containsSequence("-start_number", "0");
        assertThat(valueAfter(command, "-i")).isEqualTo(framesDir.resolve("frame-%05d.png").toString());
        assertThat(command).containsSequence("-frames:v", "7");
        assertThat(command).containsSequence("-c:v", "libx264");
        assertThat(command).containsSequence("-pix_fmt", "yuv420p");
        assertThat(command).containsSequence("-movflags", "+faststart");
        assertThat(command.get(command.size() - 1)).isEqualTo(Path.of("work", "movie.mp4").toString());
        assertThat(valueAfter(command, "-vf")).startsWith("scale=1920:1080:force_original_aspect_ratio=decrease");
    }

    @Test
    void buildPrimaryCommandUsesConfiguredEncoderSettings() {
        MovieProperties properties = new MovieProperties();
        properties.getEncoder().setFfmpegPath("/opt/ffmpeg/bin/ffmpeg");
        properties.getEncoder().setPreset("slow");
        properties.getEncoder().setCrf(18);
        FfmpegMovieEncoder configured = new FfmpegMovieEncoder(properties, Runnable::run);

        List<String> command = configured.buildPrimaryCommand(
                Path.of("frames"), 2, 2.5, GEOMETRY, Path.of("out.mp4"));

        assertThat(command.get(0)).isEqualTo("/opt/ffmpeg/bin/ffmpeg");
        assertThat(command).containsSequence("-preset", "slow");
        assertThat(command).containsSequence("-crf", "18");
        assertThat(command).containsSequence("-framerate", "2.500");
    }

    @Test
    void buildRemuxCommandCopiesStreamsIntoDerivedContainer() {
        List<String> command = encoder.buildRemuxCommand(Path.of("movie.mp4"), MovieFormat.FLV, Path.of("movie.flv"));

        assertThat(command).containsSequence("-i", Path.of("movie.mp4").toString());
        assertThat(command).containsSequence("-c", "copy");
        assertThat(command).containsSequence("-f", "flv");
        assertThat(command.get(command.size() - 1)).isEqualTo(Path.of("movie.flv").toString());
    }

    @Test
    void buildScaleFilterPadsToExactEvenSize() {
        assertThat(encoder.buildScaleFilter(800, 600))
                .isEqualTo("scale=800:600:force_original_aspect_ratio=decrease,pad=800:600:(ow-iw)/2:(oh-ih)/2:black,setsar=1");
    }

    @Test
    void encodeRejectsGapsInFrameNumbering() {
        Path framesDir = tempDir.resolve("frames");

        assertThatThrownBy(() -> encoder.encode(
                List.of(framesDir.resolve("frame-00000.png"), framesDir.resolve("frame-00002.png")),
                10.0,
                GEOMETRY,
                tempDir,
                "movie"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("frame-00001.png");
    }

    @Test
    void encodeRejectsEmptyFrameList() {
        assertThatThrownBy(() -> encoder.encode(List.of(), 10.0, GEOMETRY, tempDir, "movie"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void encodeReportsNonZeroExitAsEncodeFailure() {
        MovieProperties properties = new MovieProperties();
        properties.getEncoder().setFfmpegPath("false");
        FfmpegMovieEncoder failing = new FfmpegMovieEncoder(properties, Runnable::run);
        Path framesDir = tempDir.resolve("frames");

        assertThatThrownBy(() -> failing.encode(
                List.of(framesDir.resolve("frame-00000.png"), framesDir.resolve("frame-00001.png")),
                10.0,
                GEOMETRY,
                tempDir,
                "movie"))
                .isInstanceOf(EncodeException.class)
                .satisfies(e -> {
                    EncodeException encodeException = (EncodeException) e;
                    assertThat(encodeException.getStage()).isEqualTo("encode mp4");
                    assertThat(encodeException.getExitCode()).isEqualTo(1);
                    assertThat(encodeException.errorType()).isEqualTo(MovieErrorType.ENCODE_FAILED);
                });
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void encodeKillsFfmpegThatOutlivesTimeout() throws Exception {
        Path hangingBinary = tempDir.resolve("hanging-ffmpeg.sh");
        Files.writeString(hangingBinary, "#!/bin/sh\necho started\nexec sleep 30\n");
        assertThat(hangingBinary.toFile().setExecutable(true)).isTrue();
        MovieProperties properties = new MovieProperties();
        properties.getEncoder().setFfmpegPath(hangingBinary.toString());
        properties.getEncoder().setTimeout(Duration.ofSeconds(1));
        FfmpegMovieEncoder hanging = new FfmpegMovieEncoder(properties, Runnable::run);
        Path framesDir = tempDir.resolve("frames");

        long startedAt = System.nanoTime();
        assertThatThrownBy(() -> hanging.encode(
                List.of(framesDir.resolve("frame-00000.png"), framesDir.resolve("frame-00001.png")),
                10.0,
                GEOMETRY,
                tempDir,
                "movie"))
                .isInstanceOf(EncodeException.class)
                .hasMessageContaining("timed out")
                .satisfies(e -> {
                    EncodeException encodeException = (EncodeException) e;
                    assertThat(encodeException.getStage()).isEqualTo("encode mp4");
                    assertThat(encodeException.getExitCode()).isNull();
                });
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(20));
    }

    @Test
    void encodeReportsMissingBinaryAsEncodeFailure() {
        MovieProperties properties = new MovieProperties();
        properties.getEncoder().setFfmpegPath(tempDir.resolve("no-such-ffmpeg").toString());
        FfmpegMovieEncoder missing = new FfmpegMovieEncoder(properties, Runnable::run);

        assertThatThrownBy(() -> missing.encode(
                List.of(tempDir.resolve("frames").resolve("frame-00000.png")),
                10.0,
                GEOMETRY,
                tempDir,
                "movie"))
                .isInstanceOf(EncodeException.class)
                .hasMessageContaining("Could not start FFmpeg");
    }

    private String valueAfter(List<String> command, String option) {
        int index = command.indexOf(option);
        assertThat(index).isGreaterThanOrEqualTo(0);
        assertThat(index + 1).isLessThan(command.size());
        return command.get(index + 1);
    }
}
