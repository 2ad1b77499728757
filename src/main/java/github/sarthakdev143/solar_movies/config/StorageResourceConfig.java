package github.sarthakdev143.solar_movies.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(MovieProperties.class)
public class StorageResourceConfig implements WebMvcConfigurer {

    private static final String FILES_PATH_PATTERN = "/files/**";

    private final MovieProperties properties;

    public StorageResourceConfig(MovieProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = properties.getStorage().getRoot().toAbsolutePath().toUri().toString();
        registry.addResourceHandler(FILES_PATH_PATTERN)
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
