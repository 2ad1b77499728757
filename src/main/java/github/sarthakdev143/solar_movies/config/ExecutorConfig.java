package github.sarthakdev143.solar_movies.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    public static final String MOVIE_JOB_EXECUTOR = "movieJobExecutor";
    public static final String ENCODER_EXECUTOR = "encoderExecutor";

    @Bean(name = MOVIE_JOB_EXECUTOR)
    public ThreadPoolTaskExecutor movieJobExecutor(MovieProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkers().getPoolSize());
        executor.setMaxPoolSize(properties.getWorkers().getPoolSize());
        executor.setQueueCapacity(properties.getWorkers().getQueueCapacity());
        executor.setThreadNamePrefix("movie-job-");
        executor.initialize();
        return executor;
    }

    @Bean(name = ENCODER_EXECUTOR)
    public ThreadPoolTaskExecutor encoderExecutor(MovieProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkers().getEncoderPoolSize());
        executor.setMaxPoolSize(properties.getWorkers().getEncoderPoolSize());
        executor.setThreadNamePrefix("movie-encoder-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
