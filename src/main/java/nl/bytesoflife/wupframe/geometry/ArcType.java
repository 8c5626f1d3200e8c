package nl.bytesoflife.wupframe.geometry;

import java.util.Locale;

/**
 * Direction and size of a curve, decoded from the literal flag token of a {@code KB}
 * statement. The token is kept as written so a rebuilt statement reproduces it.
 *
 * <p>Direction: {@code ccw}/{@code cc} anywhere means counter-clockwise, {@code cw} means
 * clockwise, otherwise a trailing {@code w} means clockwise. An all upper case token asks for
 * the large arc (sweep over 180 degrees).
 */
public record ArcType(boolean clockwise, boolean largeArc, String rawToken) {

    public static final ArcType DEFAULT = new ArcType(false, false, null);

    public static ArcType parse(String token) {
        if (token == null || token.isBlank()) {
            return DEFAULT;
        }
        String trimmed = token.trim();
        String normalized = trimmed.toLowerCase(Locale.ROOT);

        boolean clockwise;
        if (normalized.contains("ccw") || normalized.contains("cc")) {
            clockwise = false;
        } else if (normalized.contains("cw")) {
            clockwise = true;
        } else {
            clockwise = normalized.endsWith("w");
        }

        boolean large = trimmed.equals(trimmed.toUpperCase(Locale.ROOT));
        return new ArcType(clockwise, large, trimmed);
    }

    /**
     * +1 for counter-clockwise, -1 for clockwise.
     */
    public int direction() {
        return clockwise ? -1 : 1;
    }
}
