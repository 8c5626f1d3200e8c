package nl.bytesoflife.wupframe.model;

import java.util.Locale;

/**
 * Drilling operation ({@code BOY local x, local z, diameter, depth}) through a framing member.
 * {@code x} and {@code z} are absolute; see the parser for how the local values are resolved.
 */
public class BoyOperation extends EditableEntity {

    private static final double DEPTH_EPSILON = 1e-6;

    private double x;
    private double z;
    private double localX;
    private double localZ;
    private final Double diameter;
    private final Double depth;
    private final BoyTarget target;
    private final double[] source;

    public BoyOperation(int statementIndex, double[] source, double x, double z, BoyTarget target) {
        super("BOY", statementIndex);
        if (source.length < 4) {
            throw new IllegalArgumentException("Drilling operation needs 4 numbers, got " + source.length);
        }
        this.source = source.clone();
        this.localX = source[0];
        this.localZ = source[1];
        this.diameter = Math.abs(source[2]);
        this.depth = source[3];
        this.x = x;
        this.z = z;
        this.target = target;
    }

    private BoyOperation(BoyOperation other) {
        super(other);
        this.x = other.x;
        this.z = other.z;
        this.localX = other.localX;
        this.localZ = other.localZ;
        this.diameter = other.diameter;
        this.depth = other.depth;
        this.target = other.target;
        this.source = other.source.clone();
    }

    @Override
    public EntityKind getEntityKind() {
        return EntityKind.BOY;
    }

    @Override
    public BoyOperation copy() {
        return new BoyOperation(this);
    }

    /**
     * Moves the operation along X or Z (through the wall); Y is not a drilling coordinate.
     */
    public boolean translate(Axis axis, double mm) {
        switch (axis) {
            case X -> {
                x += mm;
                localX += mm;
                source[0] += mm;
            }
            case Z -> {
                z += mm;
                localZ += mm;
                source[1] += mm;
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    /**
     * +1 or -1: the sign of a non-trivial depth, otherwise the wall side. A negative direction
     * drills from the top.
     */
    public int getDirection(Wall wall) {
        if (depth != null && Math.abs(depth) > DEPTH_EPSILON) {
            return depth < 0 ? -1 : 1;
        }
        return wall != null ? wall.sideSign() : 1;
    }

    public double getX() {
        return x;
    }

    public double getZ() {
        return z;
    }

    public double getLocalX() {
        return localX;
    }

    public double getLocalZ() {
        return localZ;
    }

    public Double getDiameter() {
        return diameter;
    }

    public Double getDepth() {
        return depth;
    }

    /**
     * Null when no framing member preceded the operation in its module.
     */
    public BoyTarget getTarget() {
        return target;
    }

    public double[] getSource() {
        return source.clone();
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "BoyOperation#%d[x=%.2f z=%.2f d=%.2f depth=%.2f -> %s]",
                getEditorId(), x, z, diameter, depth, target != null ? target.kind() : "none");
    }
}
