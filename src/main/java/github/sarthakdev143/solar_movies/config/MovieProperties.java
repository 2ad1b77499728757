package github.sarthakdev143.solar_movies.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "solar-movies")
public class MovieProperties {

    private final Geometry geometry = new Geometry();
    private final Frames frames = new Frames();
    private final Watchdog watchdog = new Watchdog();
    private final Workers workers = new Workers();
    private final Storage storage = new Storage();
    private final Encoder encoder = new Encoder();
    private final Eta eta = new Eta();
    private final Client client = new Client();
    private final Catalog catalog = new Catalog();

    public Geometry getGeometry() {
        return geometry;
    }

    public Frames getFrames() {
        return frames;
    }

    public Watchdog getWatchdog() {
        return watchdog;
    }

    public Workers getWorkers() {
        return workers;
    }

    public Storage getStorage() {
        return storage;
    }

    public Encoder getEncoder() {
        return encoder;
    }

    public Eta getEta() {
        return eta;
    }

    public Client getClient() {
        return client;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public static class Geometry {

        private int maxWidth = 1920;
        private int maxHeight = 1080;

        public int getMaxWidth() {
            return maxWidth;
        }

        public void setMaxWidth(int maxWidth) {
            this.maxWidth = maxWidth;
        }

        public int getMaxHeight() {
            return maxHeight;
        }

        public void setMaxHeight(int maxHeight) {
            this.maxHeight = maxHeight;
        }
    }

    public static class Frames {

        private int minViable = 2;
        private int maxFrames = 300;
        private double maxFrameRate = 30.0;
        private Duration searchTolerance = Duration.ofHours(24);

        public int getMinViable() {
            return minViable;
        }

        public void setMinViable(int minViable) {
            this.minViable = minViable;
        }

        public int getMaxFrames() {
            return maxFrames;
        }

        public void setMaxFrames(int maxFrames) {
            this.maxFrames = maxFrames;
        }

        public double getMaxFrameRate() {
            return maxFrameRate;
        }

        public void setMaxFrameRate(double maxFrameRate) {
            this.maxFrameRate = maxFrameRate;
        }

        public Duration getSearchTolerance() {
            return searchTolerance;
        }

        public void setSearchTolerance(Duration searchTolerance) {
            this.searchTolerance = searchTolerance;
        }
    }

    public static class Watchdog {

        private Duration ceiling = Duration.ofHours(24);
        private Duration retention = Duration.ofDays(7);

        public Duration getCeiling() {
            return ceiling;
        }

        public void setCeiling(Duration ceiling) {
            this.ceiling = ceiling;
        }

        /**
         * How long a finished job stays queryable after its last transition.
         */
        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Workers {

        private int poolSize = 2;
        private int queueCapacity = 100;
        private int encoderPoolSize = 2;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getEncoderPoolSize() {
            return encoderPoolSize;
        }

        public void setEncoderPoolSize(int encoderPoolSize) {
            this.encoderPoolSize = encoderPoolSize;
        }
    }

    public static class Storage {

        private Path root = Path.of("data");
        private String publicBaseUrl = "http://localhost:8080/files";

        public Path getRoot() {
            return root;
        }

        public void setRoot(Path root) {
            this.root = root;
        }

        public String getPublicBaseUrl() {
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }
    }

    public static class Encoder {

        private String ffmpegPath = "ffmpeg";
        private Duration timeout = Duration.ofMinutes(10);
        private String preset = "veryfast";
        private int crf = 23;

        public String getFfmpegPath() {
            return ffmpegPath;
        }

        public void setFfmpegPath(String ffmpegPath) {
            this.ffmpegPath = ffmpegPath;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getPreset() {
            return preset;
        }

        public void setPreset(String preset) {
            this.preset = preset;
        }

        public int getCrf() {
            return crf;
        }

        public void setCrf(int crf) {
            this.crf = crf;
        }
    }

    public static class Eta {

        private double secondsPerFrame = 0.5;
        private double encodeOverheadSeconds = 5.0;

        public double getSecondsPerFrame() {
            return secondsPerFrame;
        }

        public void setSecondsPerFrame(double secondsPerFrame) {
            this.secondsPerFrame = secondsPerFrame;
        }

        public double getEncodeOverheadSeconds() {
            return encodeOverheadSeconds;
        }

        public void setEncodeOverheadSeconds(double encodeOverheadSeconds) {
            this.encodeOverheadSeconds = encodeOverheadSeconds;
        }
    }

    public static class Client {

        private String baseUrl = "http://localhost:8080";
        private Duration minimumFirstPollDelay = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofSeconds(60);
        private Duration abandonAfter = Duration.ofHours(24);
        private Path historyFile = Path.of("movie-history.json");
        private int historyLimit = 100;
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getMinimumFirstPollDelay() {
            return minimumFirstPollDelay;
        }

        public void setMinimumFirstPollDelay(Duration minimumFirstPollDelay) {
            this.minimumFirstPollDelay = minimumFirstPollDelay;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getAbandonAfter() {
            return abandonAfter;
        }

        public void setAbandonAfter(Duration abandonAfter) {
            this.abandonAfter = abandonAfter;
        }

        public Path getHistoryFile() {
            return historyFile;
        }

        public void setHistoryFile(Path historyFile) {
            this.historyFile = historyFile;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Catalog {

        private Path root = Path.of("data/images");
        private List<Source> sources = new ArrayList<>();

        public Path getRoot() {
            return root;
        }

        public void setRoot(Path root) {
            this.root = root;
        }

        public List<Source> getSources() {
            return sources;
        }

        public void setSources(List<Source> sources) {
            this.sources = sources;
        }
    }

    public static class Source {

        private int id;
        private String name;
        private int layeringOrder;
        private double imageScale = 0.6;
        private Double sunCenterX;
        private Double sunCenterY;

        public int getId() {
            return id;
        }

        public void setId(int id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getLayeringOrder() {
            return layeringOrder;
        }

        public void setLayeringOrder(int layeringOrder) {
            this.layeringOrder = layeringOrder;
        }

        public double getImageScale() {
            return imageScale;
        }

        public void setImageScale(double imageScale) {
            this.imageScale = imageScale;
        }

        public Double getSunCenterX() {
            return sunCenterX;
        }

        public void setSunCenterX(Double sunCenterX) {
            this.sunCenterX = sunCenterX;
        }

        public Double getSunCenterY() {
            return sunCenterY;
        }

        public void setSunCenterY(Double sunCenterY) {
            this.sunCenterY = sunCenterY;
        }
    }
}
