package nl.bytesoflife.wupframe.model;

import java.util.Locale;

/**
 * Local coordinate frame opened by {@code MODUL} and closed by {@code ENDMODUL}.
 */
public class WallModule {

    private final double width;
    private final double height;
    private final double thickness;
    private final double originX;
    private final double originY;
    private final double originZ;

    public WallModule(double width, double height, double thickness,
                      double originX, double originY, double originZ) {
        this.width = width;
        this.height = height;
        this.thickness = thickness;
        this.originX = originX;
        this.originY = originY;
        this.originZ = originZ;
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

    public double getOriginX() {
        return originX;
    }

    public double getOriginY() {
        return originY;
    }

    public double getOriginZ() {
        return originZ;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "WallModule[%.1fx%.1fx%.1f at %.1f,%.1f,%.1f]",
                width, height, thickness, originX, originY, originZ);
    }
}
