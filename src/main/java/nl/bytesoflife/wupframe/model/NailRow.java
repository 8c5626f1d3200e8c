package nl.bytesoflife.wupframe.model;

import nl.bytesoflife.wupframe.geometry.Point;

import java.util.Locale;

/**
 * A line of fasteners ({@code NR start x,y, end x,y[, spacing[, gauge]]}).
 */
public class NailRow extends EditableEntity {

    private Point start;
    private Point end;
    private final Double spacing;
    private final Double gauge;
    private final PanelLayer layer;
    private final double[] source;

    public NailRow(int statementIndex, double[] source, PanelLayer layer) {
        super("NR", statementIndex);
        if (source.length < 4) {
            throw new IllegalArgumentException("Nail row needs 4 numbers, got " + source.length);
        }
        this.source = source.clone();
        this.start = new Point(source[0], source[1]);
        this.end = new Point(source[2], source[3]);
        this.spacing = source.length > 4 ? source[4] : null;
        this.gauge = source.length > 5 ? source[5] : null;
        this.layer = layer;
    }

    private NailRow(NailRow other) {
        super(other);
        this.start = other.start;
        this.end = other.end;
        this.spacing = other.spacing;
        this.gauge = other.gauge;
        this.layer = other.layer;
        this.source = other.source.clone();
    }

    @Override
    public EntityKind getEntityKind() {
        return EntityKind.NAIL_ROW;
    }

    @Override
    public NailRow copy() {
        return new NailRow(this);
    }

    /**
     * Moves both ends along X or Y; returns false for Z, which a nail row does not have.
     */
    public boolean translate(Axis axis, double mm) {
        switch (axis) {
            case X -> {
                start = start.translate(mm, 0);
                end = end.translate(mm, 0);
                source[0] += mm;
                source[2] += mm;
            }
            case Y -> {
                start = start.translate(0, mm);
                end = end.translate(0, mm);
                source[1] += mm;
                source[3] += mm;
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    public Point getStart() {
        return start;
    }

    public Point getEnd() {
        return end;
    }

    public double getLength() {
        return start.distanceTo(end);
    }

    public Double getSpacing() {
        return spacing;
    }

    public Double getGauge() {
        return gauge;
    }

    public PanelLayer getLayer() {
        return layer;
    }

    public double[] getSource() {
        return source.clone();
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "NailRow#%d[%s -> %s, %s]", getEditorId(), start, end, layer);
    }
}
