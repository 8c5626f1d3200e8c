package nl.bytesoflife.wupframe.model;

import java.util.Locale;

/**
 * Stud, blocking or plate as an axis aligned rectangle in absolute wall coordinates.
 */
public class StructuralRect {

    private static final double RIGHT_ANGLE_TOLERANCE = 1e-6;

    private final MemberKind kind;
    private final PlateRole role;
    private final double x;
    private final double y;
    private final double localX;
    private final double localY;
    private final double width;
    private final double height;
    private final double rotation;
    private final Double offset;

    public StructuralRect(MemberKind kind, PlateRole role, double x, double y, double localX, double localY,
                          double width, double height, double rotation, Double offset) {
        this.kind = kind;
        this.role = role;
        this.x = x;
        this.y = y;
        this.localX = localX;
        this.localY = localY;
        this.width = width;
        this.height = height;
        this.rotation = rotation;
        this.offset = offset;
    }

    /**
     * Builds a member from its numeric parameters {@code length, thickness, _, x, y[, rotation[, ..., offset]]}.
     * Vertical members are {@code thickness} wide and {@code length} high, horizontal ones the
     * other way round; a rotation of 90 degrees (mod 180) swaps the two. The last number is the
     * through-thickness offset when more than six are given and no placement offset is supplied.
     *
     * @param module          active module whose origin the position is relative to, or null
     * @param placementOffset trailing numeric token of the statement, or null
     */
    public static StructuralRect fromElement(double[] numbers, MemberKind kind, PlateRole role, WallModule module,
                                             Double placementOffset) {
        if (numbers.length < 5) {
            throw new IllegalArgumentException("Structural member needs at least 5 numbers, got " + numbers.length);
        }
        double length = Math.abs(numbers[0]);
        double thickness = Math.abs(numbers[1]);
        double localX = numbers[3];
        double localY = numbers[4];
        double rotation = numbers.length > 5 ? numbers[5] : 0;

        double width;
        double height;
        if (kind.getOrientation() == MemberKind.Orientation.VERTICAL) {
            width = thickness;
            height = length;
        } else {
            width = length;
            height = thickness;
        }

        double normalized = Math.abs(((rotation % 180) + 180) % 180);
        if (Math.abs(normalized - 90) < RIGHT_ANGLE_TOLERANCE) {
            double tmp = width;
            width = height;
            height = tmp;
        }

        Double offset = placementOffset;
        if (offset == null && numbers.length > 6) {
            offset = numbers[numbers.length - 1];
        }
        double originX = module != null ? module.getOriginX() : 0;
        double originY = module != null ? module.getOriginY() : 0;

        return new StructuralRect(kind, role, originX + localX, originY + localY, localX, localY,
                width, height, rotation, offset);
    }

    public MemberKind getKind() {
        return kind;
    }

    /**
     * Top or bottom for plates, null otherwise.
     */
    public PlateRole getRole() {
        return role;
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

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getMaxX() {
        return x + width;
    }

    public double getMaxY() {
        return y + height;
    }

    public double getRotation() {
        return rotation;
    }

    public Double getOffset() {
        return offset;
    }

    public MemberKind.Orientation getOrientation() {
        return kind.getOrientation();
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s[%.2f,%.2f %.2fx%.2f%s]", kind, x, y, width, height,
                role != null ? " " + role : "");
    }
}
