package nl.bytesoflife.wupframe.model;

import java.util.Locale;

/**
 * Edit axis. X runs along the wall, Y up the wall, Z through its thickness.
 */
public enum Axis {
    X,
    Y,
    Z;

    public static Axis fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
