package nl.bytesoflife.wupframe.geometry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArcSolverTest {

    private static final double TOLERANCE = 1e-4;

    private final ArcSolver solver = new ArcSolver();

    @Test
    void minorCounterClockwiseQuarterArc() {
        Point start = new Point(10, 0);
        Point end = new Point(0, 10);

        ArcSegment arc = solver.solve(start, end, 10, ArcType.parse("ccw"));

        assertNotNull(arc);
        assertEquals(0, arc.center().x(), TOLERANCE);
        assertEquals(0, arc.center().y(), TOLERANCE);
        assertEquals(Math.PI / 2, arc.sweep(), TOLERANCE);
        assertTrue(arc.signedSweep() > 0);
        assertFalse(arc.clockwise());
        assertFalse(arc.largeArc());
        assertEquals("ccw", arc.rawType());
        assertEndpointsOnCircle(arc, 10);
    }

    @Test
    void largeFlagPicksTheOtherCenter() {
        ArcSegment arc = solver.solve(new Point(10, 0), new Point(0, 10), 10, ArcType.parse("CCW"));

        assertNotNull(arc);
        assertEquals(10, arc.center().x(), TOLERANCE);
        assertEquals(10, arc.center().y(), TOLERANCE);
        assertEquals(3 * Math.PI / 2, arc.sweep(), TOLERANCE);
        assertTrue(arc.largeArc());
        assertEndpointsOnCircle(arc, 10);
    }

    @Test
    void clockwiseArcHasNegativeSignedSweep() {
        ArcSegment arc = solver.solve(new Point(10, 0), new Point(0, 10), 10, ArcType.parse("cw"));

        assertNotNull(arc);
        assertTrue(arc.clockwise());
        assertEquals(10, arc.center().x(), TOLERANCE);
        assertEquals(10, arc.center().y(), TOLERANCE);
        assertEquals(-Math.PI / 2, arc.signedSweep(), TOLERANCE);
        assertEndpointsOnCircle(arc, 10);
    }

    @Test
    void halfCircleMatchesBothSizes() {
        ArcSegment minor = solver.solve(new Point(0, 0), new Point(20, 0), 10, ArcType.parse("ccw"));
        ArcSegment large = solver.solve(new Point(0, 0), new Point(20, 0), 10, ArcType.parse("CCW"));

        assertNotNull(minor);
        assertNotNull(large);
        assertEquals(Math.PI, minor.sweep(), TOLERANCE);
        assertEquals(Math.PI, large.sweep(), TOLERANCE);
        assertEquals(10, minor.center().x(), TOLERANCE);
    }

    @Test
    void radiusBelowHalfChordHasNoSolution() {
        assertNull(solver.solve(new Point(0, 0), new Point(100, 0), 10, ArcType.parse("cw")));
    }

    @Test
    void degenerateChordHasNoSolution() {
        assertNull(solver.solve(new Point(5, 5), new Point(5, 5), 10, ArcType.DEFAULT));
        assertNull(solver.solve(new Point(0, 0), new Point(1, 0), Double.NaN, ArcType.DEFAULT));
    }

    @Test
    void radiusMarginallyBelowHalfChordStillGivesHalfCircle() {
        // short of half the chord by less than the tolerance: a half circle, not a straight line
        ArcSegment arc = solver.solve(new Point(0, 0), new Point(20, 0), 10 - 5e-7, ArcType.parse("CW"));

        assertNotNull(arc);
        assertEquals(Math.PI, arc.sweep(), 1e-3);
        assertEquals(10, arc.center().x(), TOLERANCE);
        assertEquals(0, arc.center().y(), TOLERANCE);
    }

    @Test
    void candidateFallbackAcceptsWrongSizeArcForTinyChord() {
        // neither center gives a minor sweep in this direction, so the first non-zero sweep is
        // taken: a nearly full circle although the flag asked for the minor arc
        ArcSegment arc = solver.solve(new Point(0, 0), new Point(0.001, 0), 1000, ArcType.parse("ccw"));

        assertNotNull(arc);
        assertFalse(arc.largeArc());
        assertFalse(arc.clockwise());
        assertEquals(2 * Math.PI, arc.sweep(), 1e-5);
        assertTrue(arc.sweep() > Math.PI);
        assertEquals(arc.sweep(), arc.signedSweep(), 1e-12);
        assertEndpointsOnCircle(arc, 1000);
    }

    @ParameterizedTest
    @CsvSource({
            "ccw, false, false",
            "CCW, false, true",
            "cw, true, false",
            "CW, true, true",
            "ACW, true, true",
            "Acw, true, false",
            "ACC, false, true",
            "w, true, false"
    })
    void startAnglePlusSignedSweepReachesEndPoint(String token, boolean clockwise, boolean large) {
        double angle = Math.toRadians(100);
        Point start = new Point(10, 0);
        Point end = new Point(10 * Math.cos(angle), 10 * Math.sin(angle));

        ArcSegment arc = solver.solve(start, end, 10, ArcType.parse(token));

        assertNotNull(arc);
        assertEquals(clockwise, arc.clockwise());
        assertEquals(large, arc.largeArc());
        assertEquals(large, arc.sweep() > Math.PI);
        assertTrue(arc.pointAt(arc.startAngle() + arc.signedSweep()).distanceTo(arc.to()) < TOLERANCE);
        assertEndpointsOnCircle(arc, 10);
    }

    @Test
    void negativeRadiusIsTakenAsMagnitude() {
        ArcSegment arc = solver.solve(new Point(10, 0), new Point(0, 10), -10, ArcType.parse("ccw"));

        assertNotNull(arc);
        assertEquals(10, arc.radius(), TOLERANCE);
    }

    @Test
    void samplingForcesExactEndpointsAndClampsSteps() {
        double angle = Math.toRadians(100);
        Point start = new Point(10, 0);
        Point end = new Point(10 * Math.cos(angle), 10 * Math.sin(angle));
        ArcSegment minor = solver.solve(start, end, 10, ArcType.parse("ccw"));
        ArcSegment large = solver.solve(start, end, 10, ArcType.parse("CCW"));

        // 100 degrees in steps of 7.5 degrees
        List<Point> minorPoints = minor.sample();
        assertEquals(15, minorPoints.size());
        assertSame(start, minorPoints.get(0));
        assertSame(end, minorPoints.get(minorPoints.size() - 1));
        // 260 degrees
        assertEquals(36, large.sample().size());

        ArcSegment shallow = solver.solve(new Point(0, 0), new Point(1, 0), 1000, ArcType.parse("ccw"));
        assertEquals(ArcSegment.MIN_SAMPLE_STEPS + 1, shallow.sample().size());
    }

    @Test
    void sweepHelpers() {
        assertEquals(Math.PI / 2, ArcSolver.unsignedSweep(0, Math.PI / 2, 1), TOLERANCE);
        assertEquals(3 * Math.PI / 2, ArcSolver.unsignedSweep(0, Math.PI / 2, -1), TOLERANCE);
        assertEquals(0, ArcSolver.unsignedSweep(1, 1, 1), TOLERANCE);
        assertEquals(2 * Math.PI, ArcSolver.signedSweep(1, 1, 1), TOLERANCE);
        assertEquals(-2 * Math.PI, ArcSolver.signedSweep(1, 1, -1), TOLERANCE);
    }

    private static void assertEndpointsOnCircle(ArcSegment arc, double radius) {
        assertEquals(radius, arc.from().distanceTo(arc.center()), TOLERANCE);
        assertEquals(radius, arc.to().distanceTo(arc.center()), TOLERANCE);
        assertEquals(0, arc.pointAt(arc.startAngle()).distanceTo(arc.from()), TOLERANCE);
        assertEquals(0, arc.pointAt(arc.startAngle() + arc.signedSweep()).distanceTo(arc.to()), TOLERANCE);
        for (Point point : arc.sample()) {
            assertEquals(radius, point.distanceTo(arc.center()), TOLERANCE);
        }
    }
}
