package nl.bytesoflife.wupframe.geometry;

/**
 * Directive fed to the {@link PathAssembler}.
 */
public sealed interface PathCommand permits PathCommand.Move, PathCommand.Line, PathCommand.Arc {

    Point target();

    record Move(Point target) implements PathCommand {}

    record Line(Point target) implements PathCommand {}

    record Arc(Point target, double radius, ArcType type) implements PathCommand {}
}
