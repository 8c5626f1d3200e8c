package nl.bytesoflife.wupframe.model;

/**
 * Kind of framing member, with the orientation its length runs in.
 */
public enum MemberKind {
    STUD(Orientation.VERTICAL),
    BLOCKING(Orientation.HORIZONTAL),
    PLATE(Orientation.HORIZONTAL);

    public enum Orientation {
        VERTICAL,
        HORIZONTAL
    }

    private final Orientation orientation;

    MemberKind(Orientation orientation) {
        this.orientation = orientation;
    }

    public Orientation getOrientation() {
        return orientation;
    }
}
