package nl.bytesoflife.wupframe.geometry;

/**
 * Straight path piece. {@code fallback} marks a line that replaced an arc without a solution.
 */
public record LineSegment(Point from, Point to, boolean fallback) implements PathSegment {

    public LineSegment(Point from, Point to) {
        this(from, to, false);
    }

    public double length() {
        return from.distanceTo(to);
    }

    @Override
    public LineSegment translate(double dx, double dy) {
        return new LineSegment(from.translate(dx, dy), to.translate(dx, dy), fallback);
    }
}
