package github.sarthakdev143.solar_movies.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.solar_movies.config.MovieProperties;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "solar-movies.client", name = "enabled", havingValue = "true")
public class MovieClientConfiguration {

    @Bean
    public MovieApiClient movieApiClient(RestClient.Builder restClientBuilder, MovieProperties properties) {
        MovieProperties.Client settings = properties.getClient();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.getRequestTimeout());
        requestFactory.setReadTimeout(settings.getRequestTimeout());
        return new RestMovieApiClient(restClientBuilder
                .baseUrl(settings.getBaseUrl())
                .requestFactory(requestFactory)
                .build());
    }

    @Bean
    public MovieHistory movieHistory(ObjectMapper objectMapper, MovieProperties properties) {
        return new JsonFileMovieHistory(
                properties.getClient().getHistoryFile(),
                objectMapper,
                properties.getClient().getHistoryLimit());
    }

    @Bean
    public MovieNotifier movieNotifier() {
        return new LoggingMovieNotifier();
    }

    @Bean(destroyMethod = "stopAll")
    public MovieStatusPoller movieStatusPoller(
            MovieApiClient movieApiClient,
            MovieHistory movieHistory,
            MovieNotifier movieNotifier,
            TaskScheduler taskScheduler,
            Clock clock,
            MovieProperties properties) {
        return new MovieStatusPoller(
                movieApiClient,
                movieHistory,
                movieNotifier,
                taskScheduler,
                clock,
                properties.getClient());
    }

    @Bean
    public ApplicationRunner movieStatusPollerResume(MovieStatusPoller movieStatusPoller) {
        return args -> movieStatusPoller.resumeAll();
    }
}
