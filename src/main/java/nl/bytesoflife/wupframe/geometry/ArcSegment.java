package nl.bytesoflife.wupframe.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Circular arc from {@code from} to {@code to} around {@code center}.
 * {@code sweep} is the unsigned angle in radians; {@code signedSweep} is negative for
 * clockwise arcs.
 */
public record ArcSegment(Point from, Point to, Point center, double radius,
                         double startAngle, double endAngle,
                         boolean clockwise, double sweep, double signedSweep,
                         boolean largeArc, String rawType) implements PathSegment {

    static final int MIN_SAMPLE_STEPS = 4;
    static final int MAX_SAMPLE_STEPS = 160;
    private static final double SAMPLE_STEP_ANGLE = Math.PI / 24;

    /**
     * Point on the circle at the given angle.
     */
    public Point pointAt(double angle) {
        return new Point(center.x() + radius * Math.cos(angle), center.y() + radius * Math.sin(angle));
    }

    /**
     * Discretizes the arc for rendering and bounds. The first and last points are exactly
     * {@code from} and {@code to}.
     */
    public List<Point> sample() {
        List<Point> points = new ArrayList<>();
        if (!Double.isFinite(signedSweep) || Math.abs(signedSweep) < Point.EPSILON || radius <= 0) {
            points.add(from);
            points.add(to);
            return points;
        }
        int steps = (int) Math.ceil(Math.abs(signedSweep) / SAMPLE_STEP_ANGLE);
        steps = Math.min(Math.max(steps, MIN_SAMPLE_STEPS), MAX_SAMPLE_STEPS);
        double delta = signedSweep / steps;
        for (int i = 0; i <= steps; i++) {
            points.add(pointAt(startAngle + delta * i));
        }
        points.set(0, from);
        points.set(points.size() - 1, to);
        return points;
    }

    @Override
    public ArcSegment translate(double dx, double dy) {
        return new ArcSegment(from.translate(dx, dy), to.translate(dx, dy), center.translate(dx, dy),
                radius, startAngle, endAngle, clockwise, sweep, signedSweep, largeArc, rawType);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "ArcSegment[%s -> %s, c=%s, r=%.4f, sweep=%.4f%s]",
                from, to, center, radius, signedSweep, clockwise ? " cw" : " ccw");
    }
}
