package github.sarthakdev143.solar_movies.service.impl;

import github.sarthakdev143.solar_movies.config.MovieProperties;
import github.sarthakdev143.solar_movies.exception.InvalidGeometryException;
import github.sarthakdev143.solar_movies.model.FrameGeometry;
import github.sarthakdev143.solar_movies.model.RegionOfInterest;
import org.springframework.stereotype.Component;

@Component
public class RegionOfInterestResolver {

    private final int maxWidth;
    private final int maxHeight;

    public RegionOfInterestResolver(MovieProperties properties) {
        this.maxWidth = properties.getGeometry().getMaxWidth();
        this.maxHeight = properties.getGeometry().getMaxHeight();
    }

    public FrameGeometry resolve(RegionOfInterest requested) {
        return FrameGeometry.of(bound(requested));
    }

    /**
     * Returns {@code requested} with its image scale inflated just enough for the pixel size to fit
     * within the configured maximum. The box itself is unchanged, so the aspect ratio is kept.
     */
    public RegionOfInterest bound(RegionOfInterest requested) {
        if (requested == null) {
            throw new InvalidGeometryException("roi is required.");
        }
        requireFinite(requested.top(), "roi.top");
        requireFinite(requested.left(), "roi.left");
        requireFinite(requested.bottom(), "roi.bottom");
        requireFinite(requested.right(), "roi.right");
        requireFinite(requested.imageScale(), "roi.imageScale");

        if (requested.imageScale() <= 0.0) {
            throw new InvalidGeometryException("roi.imageScale must be greater than 0.");
        }

        double width = requested.pixelWidth();
        double height = requested.pixelHeight();
        if (width <= 0.0 || height <= 0.0) {
            throw new InvalidGeometryException(
                    "roi must satisfy right > left and bottom > top, resolved size was "
                            + width + "x" + height + " pixels.");
        }

        if (width <= maxWidth && height <= maxHeight) {
            return requested;
        }

        double factor = Math.max(width / maxWidth, height / maxHeight);
        return requested.withImageScale(requested.imageScale() * factor);
    }

    private void requireFinite(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new InvalidGeometryException(fieldName + " must be a finite number.");
        }
    }
}
