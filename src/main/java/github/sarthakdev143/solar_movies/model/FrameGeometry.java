package github.sarthakdev143.solar_movies.model;

/**
 * Pixel geometry shared by every frame of a movie. Width and height are always even so the
 * H.264 encoder accepts them.
 */
public record FrameGeometry(
        RegionOfInterest roi,
        int width,
        int height) {

    public FrameGeometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive.");
        }
        if (width % 2 != 0 || height % 2 != 0) {
            throw new IllegalArgumentException("Frame dimensions must be even, got " + width + "x" + height + ".");
        }
    }

    public static FrameGeometry of(RegionOfInterest roi) {
        return new FrameGeometry(roi, evenDimension(roi.pixelWidth()), evenDimension(roi.pixelHeight()));
    }

    public double imageScale() {
        return roi.imageScale();
    }

    static int evenDimension(double size) {
        int rounded = (int) Math.round(size);
        if (rounded < 1) {
            rounded = 1;
        }
        return rounded % 2 == 0 ? rounded : rounded + 1;
    }
}
