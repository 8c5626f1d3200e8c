package nl.bytesoflife.wupframe.model;

/**
 * Which plate a horizontal {@code OG}/{@code UG} member is.
 */
public enum PlateRole {
    TOP,
    BOTTOM
}
