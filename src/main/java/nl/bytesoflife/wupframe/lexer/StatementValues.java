package nl.bytesoflife.wupframe.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbers and raw tokens of a statement body.
 * Numbers are every signed decimal in the body, left to right; tokens are the comma separated
 * pieces, used where a literal flag or label must survive as written.
 */
public final class StatementValues {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");

    private final String body;
    private final double[] numbers;
    private final List<String> tokens;

    private StatementValues(String body, double[] numbers, List<String> tokens) {
        this.body = body;
        this.numbers = numbers;
        this.tokens = tokens;
    }

    public static StatementValues of(String body) {
        String text = body != null ? body : "";
        return new StatementValues(text, extractNumbers(text), splitTokens(text));
    }

    static double[] extractNumbers(String body) {
        List<Double> found = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(body);
        while (matcher.find()) {
            found.add(Double.parseDouble(matcher.group()));
        }
        double[] result = new double[found.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = found.get(i);
        }
        return result;
    }

    static List<String> splitTokens(String body) {
        if (body.isEmpty()) return List.of();
        List<String> result = new ArrayList<>();
        for (String token : body.split(",")) {
            String trimmed = token.replaceAll(";+$", "").trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public static boolean isNumericToken(String token) {
        return token != null && NUMERIC_TOKEN.matcher(token).matches();
    }

    public String body() {
        return body;
    }

    public int count() {
        return numbers.length;
    }

    public double get(int index) {
        return numbers[index];
    }

    /**
     * The number at {@code index}, or null when the statement has fewer numbers.
     */
    public Double optional(int index) {
        return index < numbers.length ? numbers[index] : null;
    }

    public double getOrDefault(int index, double fallback) {
        return index < numbers.length ? numbers[index] : fallback;
    }

    public double[] numbers() {
        return numbers.clone();
    }

    public double[] numbersFrom(int index) {
        if (index >= numbers.length) return new double[0];
        return Arrays.copyOfRange(numbers, index, numbers.length);
    }

    public List<String> tokens() {
        return tokens;
    }

    /**
     * The token at {@code index}, or null.
     */
    public String token(int index) {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * First token that is not a plain number, used as a material label.
     */
    public String firstTextToken() {
        for (String token : tokens) {
            if (!isNumericToken(token)) {
                return token;
            }
        }
        return null;
    }

    /**
     * Numbers taken only from purely numeric tokens, so a label such as {@code OSB3} does not
     * contribute a digit.
     */
    public double[] numericTokenValues() {
        return tokens.stream()
                .filter(StatementValues::isNumericToken)
                .mapToDouble(Double::parseDouble)
                .toArray();
    }

    /**
     * The last token when it is numeric, else null.
     */
    public Double trailingNumericToken() {
        if (tokens.isEmpty()) return null;
        String last = tokens.get(tokens.size() - 1);
        return isNumericToken(last) ? Double.parseDouble(last) : null;
    }

    @Override
    public String toString() {
        return "StatementValues" + Arrays.toString(numbers);
    }
}
