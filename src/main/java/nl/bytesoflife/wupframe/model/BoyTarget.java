package nl.bytesoflife.wupframe.model;

/**
 * The framing member that was most recently created when a drilling operation was read.
 * This is parser context, not a geometric match, and can go stale after edits.
 */
public record BoyTarget(MemberKind kind, PlateRole role, StructuralRect element) {

    public static BoyTarget of(StructuralRect element) {
        return new BoyTarget(element.getKind(), element.getRole(), element);
    }
}
