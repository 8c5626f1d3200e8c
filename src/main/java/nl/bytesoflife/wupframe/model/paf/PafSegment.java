package nl.bytesoflife.wupframe.model.paf;

import nl.bytesoflife.wupframe.model.Bounds;

import java.util.List;

/**
 * One cut of a {@link PafRouting}: a circle or a polygon/polyline path. Segments are
 * immutable; edits produce new instances.
 */
public abstract class PafSegment {

    public enum Kind {
        CIRCLE,
        POLYGON,
        POLYLINE
    }

    public abstract Kind getKind();

    /**
     * Statements that produced this segment, in source order.
     */
    public abstract List<Integer> getStatementIndices();

    /**
     * Cut depth as a magnitude, or null.
     */
    public abstract Double getDepth();

    /**
     * Depth with its sign as written, or null.
     */
    public abstract Double getDepthRaw();

    public abstract Double getOrientation();

    /**
     * Four-digit machine control code, rounded; null when the statements carried none.
     */
    public abstract Integer getControlCode();

    public abstract void extendBounds(Bounds bounds);

    public abstract PafSegment translate(double dx, double dy);
}
