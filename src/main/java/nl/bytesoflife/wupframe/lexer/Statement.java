package nl.bytesoflife.wupframe.lexer;

/**
 * One terminator-delimited WUP statement, split into its command word and parameter body.
 * The text is kept verbatim (trimmed) so it can be written back unchanged.
 */
public record Statement(int index, String text, String command, String body) {

    public static Statement of(int index, String text) {
        int firstSpace = text.indexOf(' ');
        if (firstSpace == -1) {
            return new Statement(index, text, text, "");
        }
        return new Statement(index, text,
                text.substring(0, firstSpace).trim(),
                text.substring(firstSpace + 1).trim());
    }

    public WupCommand kind() {
        return WupCommand.fromWord(command);
    }

    public StatementValues values() {
        return StatementValues.of(body);
    }

    @Override
    public String toString() {
        return "#" + index + " " + text;
    }
}
