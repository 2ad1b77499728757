package github.sarthakdev143.solar_movies.service;

import github.sarthakdev143.solar_movies.model.DataSource;
import github.sarthakdev143.solar_movies.model.ImageReference;

import java.time.Instant;
import java.util.Optional;

/**
 * Lookup into the solar image archive. Implementations only resolve references; they never
 * decide whether an image is close enough to be used.
 */
public interface DataSourceCatalog {

    Optional<DataSource> findDataSource(int sourceId);

    Optional<ImageReference> findClosestImage(int sourceId, Instant timestamp);
}
