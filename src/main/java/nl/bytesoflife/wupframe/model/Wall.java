package nl.bytesoflife.wupframe.model;

/**
 * Wall element from the {@code ELM} statement. Thickness and side are optional.
 * A positive side means the inner (PLI) face is the positive one.
 */
public record Wall(double width, double height, Double thickness, Double side) {

    public int sideSign() {
        return side == null || side >= 0 ? 1 : -1;
    }
}
