package nl.bytesoflife.wupframe.serializer;

import nl.bytesoflife.wupframe.lexer.WupLexer;
import nl.bytesoflife.wupframe.model.WupModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a model's statement list back to WUP text. Deleted (null) and blank statements are
 * skipped; everything else is written as stored, one statement per line.
 */
public class WupSerializer {

    private String lineSeparator = "\n";

    public WupSerializer setLineSeparator(String lineSeparator) {
        if (lineSeparator == null || lineSeparator.isEmpty()) {
            throw new IllegalArgumentException("Line separator must not be empty");
        }
        this.lineSeparator = lineSeparator;
        return this;
    }

    public SerializedWup serialize(WupModel model) {
        return serialize(model.getStatements(), model.getSourceText());
    }

    public SerializedWup serialize(List<String> statements, String sourceText) {
        List<String> lines = new ArrayList<>();
        for (String statement : statements) {
            String line = normalize(statement);
            if (line != null) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            return new SerializedWup(null, sourceText != null ? sourceText : "");
        }
        return new SerializedWup(String.join(lineSeparator, lines) + lineSeparator, sourceText);
    }

    static String normalize(String statement) {
        if (statement == null) return null;
        String trimmed = statement.trim();
        if (trimmed.isEmpty()) return null;
        return trimmed.charAt(trimmed.length() - 1) == WupLexer.TERMINATOR ? trimmed : trimmed + WupLexer.TERMINATOR;
    }
}
