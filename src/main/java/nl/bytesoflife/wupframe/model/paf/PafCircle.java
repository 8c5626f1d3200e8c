package nl.bytesoflife.wupframe.model.paf;

import nl.bytesoflife.wupframe.geometry.Point;
import nl.bytesoflife.wupframe.model.Bounds;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Circular cut from one {@code MP center x, y, radius[, depth[, orientation[, feed, ...]]]}
 * statement. The orientation number doubles as the control code.
 */
public class PafCircle extends PafSegment {

    private final int statementIndex;
    private final Point center;
    private final double radius;
    private final Double depthRaw;
    private final Double orientation;
    private final Double feed;
    private final double[] source;

    public PafCircle(int statementIndex, double[] source) {
        if (source.length < 3) {
            throw new IllegalArgumentException("Circle cut needs 3 numbers, got " + source.length);
        }
        this.statementIndex = statementIndex;
        this.source = source.clone();
        this.center = new Point(source[0], source[1]);
        this.radius = Math.abs(source[2]);
        this.depthRaw = source.length > 3 ? source[3] : null;
        this.orientation = source.length > 4 ? source[4] : null;
        this.feed = source.length > 5 ? source[5] : null;
    }

    @Override
    public Kind getKind() {
        return Kind.CIRCLE;
    }

    @Override
    public List<Integer> getStatementIndices() {
        return List.of(statementIndex);
    }

    public int getStatementIndex() {
        return statementIndex;
    }

    public Point getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }

    @Override
    public Double getDepth() {
        return depthRaw != null ? Math.abs(depthRaw) : null;
    }

    @Override
    public Double getDepthRaw() {
        return depthRaw;
    }

    @Override
    public Double getOrientation() {
        return orientation;
    }

    public Double getFeed() {
        return feed;
    }

    public double[] getExtras() {
        return source.length > 6 ? Arrays.copyOfRange(source, 6, source.length) : new double[0];
    }

    @Override
    public Integer getControlCode() {
        return orientation != null ? (int) Math.round(orientation) : null;
    }

    public double[] getSource() {
        return source.clone();
    }

    @Override
    public void extendBounds(Bounds bounds) {
        bounds.extend(center.x() - radius, center.y() - radius);
        bounds.extend(center.x() + radius, center.y() + radius);
    }

    @Override
    public PafCircle translate(double dx, double dy) {
        double[] moved = source.clone();
        moved[0] += dx;
        moved[1] += dy;
        return new PafCircle(statementIndex, moved);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "PafCircle[c=%s r=%.2f depth=%s]", center, radius, getDepth());
    }
}
