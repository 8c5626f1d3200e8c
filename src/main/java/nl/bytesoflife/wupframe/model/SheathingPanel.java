package nl.bytesoflife.wupframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Sheathing board from {@code PLI1}/{@code PLA1}, with the boundary points of the {@code PP}
 * statements that directly follow it.
 */
public class SheathingPanel {

    private final PanelLayer layer;
    private final double width;
    private final double height;
    private final double thickness;
    private final double x;
    private final double y;
    private final double localX;
    private final double localY;
    private final Double offset;
    private final double rotation;
    private final Double materialIndex;
    private final String material;
    private final List<PanelPoint> points = new ArrayList<>();

    public SheathingPanel(PanelLayer layer, double width, double height, double thickness,
                          double x, double y, double localX, double localY,
                          Double offset, double rotation, Double materialIndex, String material) {
        this.layer = layer;
        this.width = width;
        this.height = height;
        this.thickness = thickness;
        this.x = x;
        this.y = y;
        this.localX = localX;
        this.localY = localY;
        this.offset = offset;
        this.rotation = rotation;
        this.materialIndex = materialIndex;
        this.material = material;
    }

    /**
     * Boundary point. Thickness and offset fall back to the panel's own values.
     */
    public record PanelPoint(double x, double y, Double thickness, Double offset, double[] extras) {}

    public void addPoint(PanelPoint point) {
        points.add(point);
    }

    public List<PanelPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public PanelLayer getLayer() {
        return layer;
    }

    public int getFaceDirection() {
        return layer.getFaceDirection();
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getThickness() {
        return thickness;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getLocalX() {
        return localX;
    }

    public double getLocalY() {
        return localY;
    }

    public Double getOffset() {
        return offset;
    }

    public double getRotation() {
        return rotation;
    }

    public Double getMaterialIndex() {
        return materialIndex;
    }

    public String getMaterial() {
        return material;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "SheathingPanel[%s %.1fx%.1f at %.1f,%.1f, %s, %d points]",
                layer, width, height, x, y, material, points.size());
    }
}
