package nl.bytesoflife.wupframe.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed vocabulary of WUP command words understood by the parser.
 * {@link #UNKNOWN} covers every other word.
 */
public enum WupCommand {
    ELM("ELM", 2),
    MODUL("MODUL", 5),
    ENDMODUL("ENDMODUL", 0),
    QS("QS", 5),
    LS("LS", 5),
    OG("OG", 5),
    UG("UG", 5),
    PAF("PAF", 0),
    MP("MP", 3),
    PLI1("PLI1", 6),
    PLA1("PLA1", 6),
    PP("PP", 2),
    KB("KB", 3),
    NR("NR", 4),
    BOY("BOY", 4),
    UNKNOWN(null, 0);

    private static final Map<String, WupCommand> BY_WORD = Arrays.stream(values())
            .filter(c -> c.word != null)
            .collect(Collectors.toUnmodifiableMap(c -> c.word, Function.identity()));

    private final String word;
    private final int minNumbers;

    WupCommand(String word, int minNumbers) {
        this.word = word;
        this.minNumbers = minNumbers;
    }

    public String getWord() {
        return word;
    }

    /**
     * Minimum count of numeric parameters the command needs to produce anything.
     */
    public int getMinNumbers() {
        return minNumbers;
    }

    public boolean accepts(StatementValues values) {
        return values.count() >= minNumbers;
    }

    /**
     * Command words are matched exactly (WUP is upper case).
     */
    public static WupCommand fromWord(String word) {
        if (word == null) return UNKNOWN;
        return BY_WORD.getOrDefault(word, UNKNOWN);
    }
}
