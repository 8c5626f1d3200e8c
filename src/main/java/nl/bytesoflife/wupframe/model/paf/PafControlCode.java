package nl.bytesoflife.wupframe.model.paf;

/**
 * Decoded four-digit routing control code. Ones select the tool category, tens the edge mode,
 * hundreds the radius compensation and thousands the spindle rotation.
 */
public record PafControlCode(Integer code, int thousands, int hundreds, int tens, int ones) {

    public static final PafControlCode UNKNOWN = new PafControlCode(null, 0, 0, 0, 0);

    public enum ToolCategory {
        MACHINE_DEFAULT("Machine default"),
        CYLINDRICAL("Cylindrical trimmer"),
        CHAMFER("Chamfer trimmer"),
        HORIZONTAL_GROOVE("Horizontal groove trimmer"),
        VERTICAL_MARKING("Vertical marking trimmer"),
        RESERVED("Reserved");

        private final String label;

        ToolCategory(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        static ToolCategory fromDigit(int digit) {
            return switch (digit) {
                case 0 -> MACHINE_DEFAULT;
                case 1 -> CYLINDRICAL;
                case 2 -> CHAMFER;
                case 3 -> HORIZONTAL_GROOVE;
                case 4 -> VERTICAL_MARKING;
                default -> RESERVED;
            };
        }
    }

    public enum EdgeMode {
        STANDARD,
        OVERCUT,
        UNDERCUT,
        RESERVED;

        static EdgeMode fromDigit(int digit) {
            return switch (digit) {
                case 0 -> STANDARD;
                case 1 -> OVERCUT;
                case 2 -> UNDERCUT;
                default -> RESERVED;
            };
        }
    }

    public enum Compensation {
        AUTO,
        LEFT,
        RIGHT,
        CENTER,
        RESERVED;

        static Compensation fromDigit(int digit) {
            return switch (digit) {
                case 0 -> AUTO;
                case 1 -> LEFT;
                case 2 -> RIGHT;
                case 3 -> CENTER;
                default -> RESERVED;
            };
        }
    }

    public enum Rotation {
        MACHINE_DEFAULT,
        SYNCHRONOUS,
        RESERVED;

        static Rotation fromDigit(int digit) {
            return switch (digit) {
                case 0 -> MACHINE_DEFAULT;
                case 1 -> SYNCHRONOUS;
                default -> RESERVED;
            };
        }
    }

    /**
     * Decodes a raw code; the sign is ignored. Null or non-finite yields {@link #UNKNOWN}.
     */
    public static PafControlCode decode(Double raw) {
        if (raw == null || !Double.isFinite(raw)) {
            return UNKNOWN;
        }
        int code = (int) Math.round(raw);
        int abs = Math.abs(code);
        return new PafControlCode(code, (abs / 1000) % 10, (abs / 100) % 10, (abs / 10) % 10, abs % 10);
    }

    /**
     * Control code of a segment: its own code, else its orientation, else unknown.
     */
    public static PafControlCode of(PafSegment segment) {
        if (segment == null) {
            return UNKNOWN;
        }
        if (segment.getControlCode() != null) {
            return decode(segment.getControlCode().doubleValue());
        }
        return decode(segment.getOrientation());
    }

    public boolean isValid() {
        return code != null;
    }

    public ToolCategory getToolCategory() {
        return ToolCategory.fromDigit(ones);
    }

    public EdgeMode getEdgeMode() {
        return EdgeMode.fromDigit(tens);
    }

    public Compensation getCompensation() {
        return Compensation.fromDigit(hundreds);
    }

    public Rotation getRotation() {
        return Rotation.fromDigit(thousands);
    }

    public boolean hasOvercut() {
        return tens == 1;
    }

    public boolean hasUndercut() {
        return tens == 2;
    }

    /**
     * True when the machine widens the cut beyond the programmed contour.
     */
    public boolean addsRadius() {
        Compensation compensation = getCompensation();
        return compensation == Compensation.LEFT || compensation == Compensation.CENTER;
    }
}
