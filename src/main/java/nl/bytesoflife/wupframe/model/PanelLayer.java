package nl.bytesoflife.wupframe.model;

/**
 * Wall face a sheathing panel, nail row or routing belongs to.
 */
public enum PanelLayer {
    PLI(1),
    PLA(-1);

    private final int faceDirection;

    PanelLayer(int faceDirection) {
        this.faceDirection = faceDirection;
    }

    public int getFaceDirection() {
        return faceDirection;
    }
}
