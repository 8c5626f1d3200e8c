package nl.bytesoflife.wupframe.model;

import nl.bytesoflife.wupframe.geometry.Point;
import nl.bytesoflife.wupframe.model.paf.PafRouting;
import org.locationtech.jts.geom.Envelope;

import java.util.Locale;

/**
 * Running 2-D axis-aligned bounds of everything seen in a model.
 * Drilling operations contribute in the (x, z) plane, everything else in (x, y).
 */
public class Bounds {

    private final Envelope envelope;

    public Bounds() {
        this.envelope = new Envelope();
    }

    private Bounds(Envelope envelope) {
        this.envelope = envelope;
    }

    public void extend(double x, double y) {
        if (Double.isFinite(x) && Double.isFinite(y)) {
            envelope.expandToInclude(x, y);
        }
    }

    public void extend(Point point) {
        extend(point.x(), point.y());
    }

    public void extendRect(double x, double y, double width, double height) {
        extend(x, y);
        extend(x + width, y + height);
    }

    public void extend(StructuralRect rect) {
        extendRect(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight());
    }

    /**
     * True until the first finite coordinate arrives.
     */
    public boolean isEmpty() {
        return envelope.isNull();
    }

    public double getMinX() {
        return envelope.getMinX();
    }

    public double getMaxX() {
        return envelope.getMaxX();
    }

    public double getMinY() {
        return envelope.getMinY();
    }

    public double getMaxY() {
        return envelope.getMaxY();
    }

    public double getWidth() {
        return envelope.getWidth();
    }

    public double getHeight() {
        return envelope.getHeight();
    }

    public boolean contains(double x, double y) {
        return envelope.covers(x, y);
    }

    public Envelope toEnvelope() {
        return new Envelope(envelope);
    }

    public Bounds copy() {
        return new Bounds(new Envelope(envelope));
    }

    /**
     * Recomputes bounds from the entities of a model, as needed after an edit.
     * An empty model collapses to a zero rectangle at the origin.
     */
    public static Bounds of(WupModel model) {
        Bounds bounds = new Bounds();
        for (StructuralRect rect : model.getStructuralRects()) {
            bounds.extend(rect);
        }
        for (SheathingPanel panel : model.getSheathing()) {
            bounds.extendRect(panel.getX(), panel.getY(), panel.getWidth(), panel.getHeight());
            for (SheathingPanel.PanelPoint point : panel.getPoints()) {
                bounds.extend(point.x(), point.y());
            }
        }
        for (NailRow row : model.getNailRows()) {
            bounds.extend(row.getStart());
            bounds.extend(row.getEnd());
        }
        for (BoyOperation op : model.getBoyOperations()) {
            bounds.extend(op);
        }
        for (PafRouting routing : model.getPafRoutings()) {
            routing.extendBounds(bounds);
        }
        if (bounds.isEmpty()) {
            bounds.extend(0, 0);
        }
        return bounds;
    }

    public void extend(BoyOperation op) {
        double radius = op.getDiameter() != null ? op.getDiameter() / 2 : 0;
        extend(op.getX() - radius, op.getZ());
        extend(op.getX() + radius, op.getZ());
    }

    @Override
    public String toString() {
        if (isEmpty()) return "Bounds[empty]";
        return String.format(Locale.US, "Bounds[(%.3f, %.3f) - (%.3f, %.3f)]",
                getMinX(), getMinY(), getMaxX(), getMaxY());
    }
}
