package github.sarthakdev143.solar_movies.model;

public record RegionOfInterest(
        double top,
        double left,
        double bottom,
        double right,
        double imageScale) {

    public double pixelWidth() {
        return (right - left) / imageScale;
    }

    public double pixelHeight() {
        return (bottom - top) / imageScale;
    }

    public RegionOfInterest withImageScale(double newImageScale) {
        return new RegionOfInterest(top, left, bottom, right, newImageScale);
    }
}
