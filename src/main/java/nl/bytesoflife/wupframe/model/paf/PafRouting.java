package nl.bytesoflife.wupframe.model.paf;

import nl.bytesoflife.wupframe.model.Axis;
import nl.bytesoflife.wupframe.model.Bounds;
import nl.bytesoflife.wupframe.model.EditableEntity;
import nl.bytesoflife.wupframe.model.EntityKind;
import nl.bytesoflife.wupframe.model.PanelLayer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A routing block: the {@code PAF tool, face, passes} header and the circle and path cuts that
 * follow it.
 */
public class PafRouting extends EditableEntity {

    private final Double tool;
    private final Double face;
    private final Double passes;
    private final PanelLayer layer;
    private final double[] header;
    private final String body;
    private final List<PafSegment> segments = new ArrayList<>();

    public PafRouting(int statementIndex, double[] header, String body, PanelLayer layer) {
        super("PAF", statementIndex);
        this.header = header.clone();
        this.body = body != null ? body : "";
        this.tool = header.length > 0 ? header[0] : null;
        this.face = header.length > 1 ? header[1] : null;
        this.passes = header.length > 2 ? header[2] : null;
        this.layer = layer;
    }

    private PafRouting(PafRouting other) {
        super(other);
        this.tool = other.tool;
        this.face = other.face;
        this.passes = other.passes;
        this.layer = other.layer;
        this.header = other.header.clone();
        this.body = other.body;
        this.segments.addAll(other.segments);
    }

    @Override
    public EntityKind getEntityKind() {
        return EntityKind.PAF;
    }

    @Override
    public PafRouting copy() {
        return new PafRouting(this);
    }

    /**
     * Appends a finished cut. Statement indices are recorded separately, as each vertex arrives.
     */
    public void addSegment(PafSegment segment) {
        segments.add(segment);
    }

    /**
     * Moves every cut along X or Y; returns false for Z.
     */
    public boolean translate(Axis axis, double mm) {
        if (axis != Axis.X && axis != Axis.Y) {
            return false;
        }
        double dx = axis == Axis.X ? mm : 0;
        double dy = axis == Axis.Y ? mm : 0;
        segments.replaceAll(segment -> segment.translate(dx, dy));
        return true;
    }

    public void extendBounds(Bounds bounds) {
        for (PafSegment segment : segments) {
            segment.extendBounds(bounds);
        }
    }

    public List<PafSegment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public Double getTool() {
        return tool;
    }

    public Double getFace() {
        return face;
    }

    public Double getPasses() {
        return passes;
    }

    /**
     * Layer of the most recent sheathing panel before the routing, or null.
     */
    public PanelLayer getLayer() {
        return layer;
    }

    public double[] getHeader() {
        return header.clone();
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "PafRouting#" + getEditorId() + "[" + segments.size() + " segments, layer=" + layer + "]";
    }
}
