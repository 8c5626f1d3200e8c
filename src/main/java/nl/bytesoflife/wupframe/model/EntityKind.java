package nl.bytesoflife.wupframe.model;

import java.util.Locale;

public enum EntityKind {
    NAIL_ROW,
    BOY,
    PAF;

    /**
     * Accepts the command word ({@code NR}, {@code BOY}, {@code PAF}) or the constant name,
     * in any case.
     */
    public static EntityKind fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "nr", "nail_row", "nailrow" -> NAIL_ROW;
            case "boy" -> BOY;
            case "paf" -> PAF;
            default -> throw new IllegalArgumentException("Unknown entity kind: " + name);
        };
    }
}
