package nl.bytesoflife.wupframe.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of {@link PathAssembler#assemble}.
 *
 * @param sampledPoints every point produced while walking the commands, arcs discretized,
 *                      before de-duplication
 * @param pathSegments  structured line and arc pieces in command order
 * @param points        de-duplicated outline; for a polygon the closing point is not repeated
 * @param kind          polygon, polyline or empty
 */
public record AssembledPath(List<Point> sampledPoints, List<PathSegment> pathSegments,
                            List<Point> points, Kind kind) {

    public enum Kind {
        POLYGON,
        POLYLINE,
        EMPTY
    }

    public AssembledPath {
        sampledPoints = List.copyOf(sampledPoints);
        pathSegments = List.copyOf(pathSegments);
        points = List.copyOf(points);
    }

    public boolean isClosed() {
        return kind == Kind.POLYGON;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    /**
     * Outline with the first point appended again when closed.
     */
    public List<Point> ring() {
        if (!isClosed()) return points;
        List<Point> ring = new ArrayList<>(points);
        ring.add(points.get(0));
        return ring;
    }
}
