package nl.bytesoflife.wupframe.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a run of move/line/arc directives into a sampled outline plus structured segments.
 * An arc without a solution becomes a straight line flagged as fallback; the path is never
 * abandoned.
 */
public class PathAssembler {

    private static final Logger log = LoggerFactory.getLogger(PathAssembler.class);

    private final ArcSolver arcSolver;

    public PathAssembler() {
        this(new ArcSolver());
    }

    public PathAssembler(ArcSolver arcSolver) {
        this.arcSolver = arcSolver;
    }

    public AssembledPath assemble(List<PathCommand> commands) {
        List<Point> sampled = new ArrayList<>();
        List<PathSegment> segments = new ArrayList<>();
        Point current = null;

        for (PathCommand command : commands) {
            Point target = command.target();
            if (target == null || !target.isFinite()) {
                continue;
            }
            if (command instanceof PathCommand.Move || current == null) {
                current = target;
                sampled.add(target);
                continue;
            }

            if (command instanceof PathCommand.Line) {
                segments.add(new LineSegment(current, target));
                sampled.add(target);
            } else if (command instanceof PathCommand.Arc arc) {
                ArcSegment solved = arcSolver.solve(current, target, arc.radius(), arc.type());
                if (solved != null) {
                    segments.add(solved);
                    List<Point> arcPoints = solved.sample();
                    sampled.addAll(arcPoints.subList(1, arcPoints.size()));
                } else {
                    log.debug("No arc of radius {} from {} to {}, using a straight line", arc.radius(), current, target);
                    segments.add(new LineSegment(current, target, true));
                    sampled.add(target);
                }
            }
            current = target;
        }

        return close(sampled, segments);
    }

    private AssembledPath close(List<Point> sampled, List<PathSegment> segments) {
        List<Point> deduped = dedupe(sampled);
        if (deduped.size() < 2) {
            return new AssembledPath(sampled, segments, deduped, AssembledPath.Kind.EMPTY);
        }

        boolean closed = deduped.get(0).approximatelyEquals(deduped.get(deduped.size() - 1));
        List<Point> outline;
        if (closed) {
            outline = deduped.subList(0, deduped.size() - 1);
        } else if (deduped.size() >= 3) {
            // nearly closed cut outlines are closed back to their first point
            outline = deduped;
            closed = true;
        } else {
            outline = deduped;
        }

        if (closed && outline.size() >= 3) {
            return new AssembledPath(sampled, segments, outline, AssembledPath.Kind.POLYGON);
        }
        if (outline.size() >= 2) {
            return new AssembledPath(sampled, segments, outline, AssembledPath.Kind.POLYLINE);
        }
        return new AssembledPath(sampled, segments, outline, AssembledPath.Kind.EMPTY);
    }

    /**
     * Drops non-finite points and points equal to their predecessor within {@link Point#EPSILON}.
     */
    public static List<Point> dedupe(List<Point> points) {
        List<Point> result = new ArrayList<>();
        for (Point point : points) {
            if (point == null || !point.isFinite()) continue;
            if (!result.isEmpty() && result.get(result.size() - 1).approximatelyEquals(point)) continue;
            result.add(point);
        }
        return result;
    }
}
