package nl.bytesoflife.wupframe.serializer;

import nl.bytesoflife.wupframe.model.BoyOperation;
import nl.bytesoflife.wupframe.model.NailRow;
import nl.bytesoflife.wupframe.model.paf.PafCircle;
import nl.bytesoflife.wupframe.model.paf.PafPath;
import nl.bytesoflife.wupframe.model.paf.PafRouting;
import nl.bytesoflife.wupframe.model.paf.PafSegment;
import nl.bytesoflife.wupframe.model.paf.PathSource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rebuilds statement text (without terminator) for edited entities.
 */
public final class StatementFormatter {

    private static final int KB_TYPE_POSITION = 3;

    private StatementFormatter() {
    }

    /**
     * At most three decimals, trailing zeros dropped; non-finite values become {@code 0}.
     */
    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return "0";
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    public static String statement(String command, double[] values) {
        if (values == null || values.length == 0) {
            return command;
        }
        return command + " " + Arrays.stream(values)
                .mapToObj(StatementFormatter::formatNumber)
                .collect(Collectors.joining(","));
    }

    public static String nailRow(NailRow row) {
        return statement(row.getCommand(), row.getSource());
    }

    public static String boy(BoyOperation op) {
        return statement(op.getCommand(), op.getSource());
    }

    public static String circle(PafCircle circle) {
        return statement("MP", circle.getSource());
    }

    /**
     * {@code KB} keeps its literal arc flag as the fourth comma separated part.
     */
    public static String pathSource(PathSource source) {
        String command = source.command().getWord();
        if (!source.isArc() || source.arcType() == null) {
            return statement(command, source.numbers());
        }
        List<String> parts = new ArrayList<>();
        for (double value : source.numbers()) {
            parts.add(formatNumber(value));
        }
        parts.add(Math.min(KB_TYPE_POSITION, parts.size()), source.arcType());
        return command + " " + String.join(",", parts);
    }

    public static String routingHeader(PafRouting routing) {
        return statement(routing.getCommand(), routing.getHeader());
    }

    /**
     * Statement text for every statement of a routing, keyed by statement index in source
     * order: the header followed by the cuts.
     */
    public static Map<Integer, String> routing(PafRouting routing) {
        Map<Integer, String> statements = new LinkedHashMap<>();
        statements.put(routing.getStatementIndex(), routingHeader(routing));
        for (PafSegment segment : routing.getSegments()) {
            if (segment instanceof PafCircle circle) {
                statements.put(circle.getStatementIndex(), circle(circle));
            } else if (segment instanceof PafPath path) {
                for (PathSource source : path.getSources()) {
                    statements.put(source.statementIndex(), pathSource(source));
                }
            }
        }
        return statements;
    }
}
