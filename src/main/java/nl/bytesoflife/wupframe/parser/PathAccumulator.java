package nl.bytesoflife.wupframe.parser;

import nl.bytesoflife.wupframe.geometry.PathCommand;
import nl.bytesoflife.wupframe.lexer.WupCommand;
import nl.bytesoflife.wupframe.model.paf.CutParameters;
import nl.bytesoflife.wupframe.model.paf.PathSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the vertices of one routed path and the per-vertex machining values that are
 * averaged into a single set of cut parameters.
 */
class PathAccumulator {

    private static final double TRIVIAL = 1e-6;

    private final List<PathSource> sources = new ArrayList<>();
    private final List<Double> depthSamples = new ArrayList<>();
    private final List<Double> depthRawSamples = new ArrayList<>();
    private final List<Double> offsetSamples = new ArrayList<>();
    private final List<Double> orientationSamples = new ArrayList<>();
    private final List<Double> zSamples = new ArrayList<>();

    /**
     * {@code PP x, y[, z[, offset[, orientation[, trailing, ...]]]]}
     */
    void addPoint(int statementIndex, double[] numbers) {
        Double z = at(numbers, 2);
        Double depthRaw = depthTieBreak(z, at(numbers, 5));
        sample(depthRaw, at(numbers, 3), at(numbers, 4), z);
        sources.add(new PathSource(statementIndex, WupCommand.PP, numbers, null));
    }

    /**
     * {@code KB x, y, radius, TYPE[, depth[, offset[, orientation[, z, ...]]]]}; the flag token
     * does not count as a number.
     */
    void addArc(int statementIndex, double[] numbers, String arcType) {
        Double z = at(numbers, 6);
        Double depthRaw = depthTieBreak(at(numbers, 3), z);
        sample(depthRaw, at(numbers, 4), at(numbers, 5), z);
        sources.add(new PathSource(statementIndex, WupCommand.KB, numbers, arcType));
    }

    private void sample(Double depthRaw, Double offset, Double orientation, Double z) {
        if (depthRaw != null) {
            depthSamples.add(Math.abs(depthRaw));
            depthRawSamples.add(depthRaw);
        }
        if (offset != null) offsetSamples.add(offset);
        if (orientation != null) orientationSamples.add(orientation);
        if (z != null) zSamples.add(z);
    }

    boolean isEmpty() {
        return sources.isEmpty();
    }

    List<PathSource> getSources() {
        return sources;
    }

    List<PathCommand> toCommands() {
        List<PathCommand> commands = new ArrayList<>();
        for (int i = 0; i < sources.size(); i++) {
            commands.add(sources.get(i).toPathCommand(i == 0));
        }
        return commands;
    }

    CutParameters toParameters() {
        return new CutParameters(mean(depthSamples), mean(depthRawSamples), mean(offsetSamples),
                mean(orientationSamples), mean(zSamples));
    }

    /**
     * Picks the depth from two candidate values. The first wins when it is present and
     * non-trivial or the second is missing; a trivial first yields to a larger second; a
     * trivial second yields to a larger first; otherwise the smaller magnitude wins, ties going
     * to the first. Null when both are missing.
     */
    static Double depthTieBreak(Double first, Double second) {
        boolean hasFirst = first != null && Double.isFinite(first);
        boolean hasSecond = second != null && Double.isFinite(second);
        if (!hasFirst && !hasSecond) {
            return null;
        }
        if (hasFirst && (!hasSecond || Math.abs(first) > TRIVIAL)) {
            return first;
        }
        if (!hasFirst) {
            return second;
        }
        if (Math.abs(first) <= TRIVIAL && Math.abs(second) > Math.abs(first)) {
            return second;
        }
        if (Math.abs(second) <= TRIVIAL && Math.abs(first) > Math.abs(second)) {
            return first;
        }
        return Math.abs(first) <= Math.abs(second) ? first : second;
    }

    static Double mean(List<Double> samples) {
        if (samples.isEmpty()) return null;
        double sum = 0;
        for (double sample : samples) {
            sum += sample;
        }
        return sum / samples.size();
    }

    private static Double at(double[] numbers, int index) {
        if (index >= numbers.length || !Double.isFinite(numbers[index])) return null;
        return numbers[index];
    }
}
