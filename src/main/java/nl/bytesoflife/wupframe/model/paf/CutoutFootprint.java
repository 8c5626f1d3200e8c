package nl.bytesoflife.wupframe.model.paf;

import nl.bytesoflife.wupframe.geometry.Point;

import java.util.List;

/**
 * Overall size of a routed opening: the bounding box of its outline widened by the tool
 * according to the radius compensation digit of the control code.
 */
public record CutoutFootprint(double baseWidth, double baseHeight, double expansion) {

    public static final double DEFAULT_TOOL_RADIUS = 8.0;

    public double width() {
        return baseWidth + expansion;
    }

    public double height() {
        return baseHeight + expansion;
    }

    /**
     * Total widening for a control code: four tool radii with left compensation, two without
     * compensation, none otherwise.
     */
    public static double expansion(PafControlCode controlCode, double toolRadius) {
        return switch (controlCode.getCompensation()) {
            case LEFT -> toolRadius * 4;
            case CENTER -> toolRadius * 2;
            default -> 0;
        };
    }

    /**
     * Returns null when no point is finite.
     */
    public static CutoutFootprint compute(List<Point> points, PafControlCode controlCode, double toolRadius) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        int count = 0;
        for (Point point : points) {
            if (point == null || !point.isFinite()) continue;
            minX = Math.min(minX, point.x());
            minY = Math.min(minY, point.y());
            maxX = Math.max(maxX, point.x());
            maxY = Math.max(maxY, point.y());
            count++;
        }
        if (count == 0) {
            return null;
        }
        return new CutoutFootprint(maxX - minX, maxY - minY, expansion(controlCode, toolRadius));
    }

    public static CutoutFootprint of(PafPath path) {
        return compute(path.getPoints(), PafControlCode.of(path), DEFAULT_TOOL_RADIUS);
    }
}
