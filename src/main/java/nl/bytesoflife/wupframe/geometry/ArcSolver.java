package nl.bytesoflife.wupframe.geometry;

/**
 * Recovers the circular arc through two points for a given radius and {@link ArcType}.
 *
 * <p>Two circles of radius r pass through the ends of a chord shorter than 2r. Their centers
 * lie on the chord's perpendicular bisector. For each center the sweep in the requested
 * direction is measured and the one agreeing with the large/minor flag is taken. When neither
 * agrees, the first center giving a non-zero sweep is accepted anyway, so malformed flags still
 * yield an arc.
 */
public class ArcSolver {

    static final double EPSILON = 1e-6;
    static final double SWEEP_TOLERANCE = 1e-5;
    private static final double TWO_PI = Math.PI * 2;

    /**
     * Returns null when there is no circle: a degenerate chord, or a radius below half the chord.
     * Callers replace the arc by a straight line in that case.
     */
    public ArcSegment solve(Point start, Point end, double radius, ArcType type) {
        if (start == null || end == null || !start.isFinite() || !end.isFinite() || !Double.isFinite(radius)) {
            return null;
        }
        double r = Math.max(Math.abs(radius), EPSILON);
        ArcType arcType = type != null ? type : ArcType.DEFAULT;
        int direction = arcType.direction();

        double dx = end.x() - start.x();
        double dy = end.y() - start.y();
        double chord = Math.hypot(dx, dy);
        if (chord < EPSILON) {
            return null;
        }
        double halfChord = chord / 2;
        if (r < halfChord - EPSILON) {
            return null;
        }

        double midX = (start.x() + end.x()) / 2;
        double midY = (start.y() + end.y()) / 2;
        double perpAngle = Math.atan2(dy, dx) + Math.PI / 2;
        double height = Math.sqrt(Math.max(r * r - halfChord * halfChord, 0));
        double offsetX = height * Math.cos(perpAngle);
        double offsetY = height * Math.sin(perpAngle);

        Point[] centers = {
                new Point(midX + offsetX, midY + offsetY),
                new Point(midX - offsetX, midY - offsetY)
        };

        Point chosen = null;
        for (Point center : centers) {
            double sweep = unsignedSweep(start, end, center, direction);
            if (!Double.isFinite(sweep) || sweep < SWEEP_TOLERANCE) {
                continue;
            }
            if (matchesSize(sweep, arcType.largeArc())) {
                chosen = center;
                break;
            }
        }

        if (chosen == null) {
            for (Point center : centers) {
                double sweep = unsignedSweep(start, end, center, direction);
                if (Double.isFinite(sweep) && sweep > SWEEP_TOLERANCE) {
                    chosen = center;
                    break;
                }
            }
        }
        if (chosen == null) {
            return null;
        }

        double startAngle = angle(start, chosen);
        double endAngle = angle(end, chosen);
        double signedSweep = signedSweep(startAngle, endAngle, direction);
        return new ArcSegment(start, end, chosen, r, startAngle, endAngle,
                direction < 0, Math.abs(signedSweep), signedSweep, arcType.largeArc(), arcType.rawToken());
    }

    private static boolean matchesSize(double sweep, boolean largeArc) {
        // a half circle counts as both sizes
        if (Math.abs(sweep - Math.PI) <= SWEEP_TOLERANCE) {
            return true;
        }
        boolean isLarge = sweep > Math.PI + SWEEP_TOLERANCE;
        return largeArc == isLarge;
    }

    private static double angle(Point p, Point center) {
        return Math.atan2(p.y() - center.y(), p.x() - center.x());
    }

    private static double unsignedSweep(Point start, Point end, Point center, int direction) {
        return unsignedSweep(angle(start, center), angle(end, center), direction);
    }

    static double unsignedSweep(double startAngle, double endAngle, int direction) {
        double sweep = direction >= 0 ? endAngle - startAngle : startAngle - endAngle;
        while (sweep < 0) {
            sweep += TWO_PI;
        }
        return sweep;
    }

    /**
     * Like {@link #unsignedSweep} but a zero sweep becomes a full turn, and clockwise sweeps are
     * negative.
     */
    static double signedSweep(double startAngle, double endAngle, int direction) {
        double sweep = direction >= 0 ? endAngle - startAngle : startAngle - endAngle;
        while (sweep <= 0) {
            sweep += TWO_PI;
        }
        return direction >= 0 ? sweep : -sweep;
    }
}
