package nl.bytesoflife.wupframe.geometry;

import java.util.Locale;

/**
 * A 2-D point in wall coordinates (mm).
 */
public record Point(double x, double y) {

    public static final double EPSILON = 1e-6;

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    /**
     * Both coordinates within {@link #EPSILON}.
     */
    public boolean approximatelyEquals(Point other) {
        return other != null
                && Math.abs(x - other.x) < EPSILON
                && Math.abs(y - other.y) < EPSILON;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.4f, %.4f)", x, y);
    }
}
