package github.sarthakdev143.solar_movies.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Nearest-in-time source image for one layer, as resolved by the data source catalog.
 *
 * @param imageScale plate scale of the source raster in arcseconds per pixel
 * @param sunCenterX x pixel coordinate of the sun center in the source raster
 * @param sunCenterY y pixel coordinate of the sun center in the source raster
 */
public record ImageReference(
        int sourceId,
        Path path,
        Instant observedAt,
        double imageScale,
        double sunCenterX,
        double sunCenterY) {
}
