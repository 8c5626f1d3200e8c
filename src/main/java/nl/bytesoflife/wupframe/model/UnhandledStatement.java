package nl.bytesoflife.wupframe.model;

import java.util.Arrays;

/**
 * A statement the parser could not turn into an entity: unknown command, too few numbers or
 * wrong context. Diagnostic only.
 */
public record UnhandledStatement(int statementIndex, String command, double[] numbers, String body) {

    @Override
    public String toString() {
        return "Unhandled[#" + statementIndex + " " + command + " " + Arrays.toString(numbers) + "]";
    }
}
