package nl.bytesoflife.wupframe.model.paf;

import nl.bytesoflife.wupframe.geometry.ArcType;
import nl.bytesoflife.wupframe.geometry.PathCommand;
import nl.bytesoflife.wupframe.geometry.Point;
import nl.bytesoflife.wupframe.lexer.WupCommand;

/**
 * The {@code PP} or {@code KB} statement behind one vertex of a routed path, kept so the
 * statement can be rewritten after an edit. {@code arcType} is the literal flag token of a
 * {@code KB}, null for {@code PP}.
 */
public record PathSource(int statementIndex, WupCommand command, double[] numbers, String arcType) {

    public PathSource {
        numbers = numbers.clone();
    }

    @Override
    public double[] numbers() {
        return numbers.clone();
    }

    public Point target() {
        return new Point(numbers[0], numbers[1]);
    }

    public boolean isArc() {
        return command == WupCommand.KB;
    }

    /**
     * Directive for the path assembler. The first vertex of a path only positions the tool.
     */
    public PathCommand toPathCommand(boolean first) {
        if (first && !isArc()) {
            return new PathCommand.Move(target());
        }
        if (isArc()) {
            return new PathCommand.Arc(target(), Math.abs(numbers[2]), ArcType.parse(arcType));
        }
        return new PathCommand.Line(target());
    }

    public PathSource translate(double dx, double dy) {
        double[] moved = numbers.clone();
        moved[0] += dx;
        moved[1] += dy;
        return new PathSource(statementIndex, command, moved, arcType);
    }
}
