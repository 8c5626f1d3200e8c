package nl.bytesoflife.wupframe.model.paf;

/**
 * Averaged machining values of a routed path. Every field is null when no vertex carried it.
 *
 * @param depth       mean of the absolute vertex depths
 * @param depthRaw    mean of the signed vertex depths
 * @param offset      mean offset, also the source of the control code
 * @param orientation mean orientation
 * @param z           mean z level
 */
public record CutParameters(Double depth, Double depthRaw, Double offset, Double orientation, Double z) {

    public static final CutParameters NONE = new CutParameters(null, null, null, null, null);

    public Integer controlCode() {
        return offset != null ? (int) Math.round(offset) : null;
    }
}
