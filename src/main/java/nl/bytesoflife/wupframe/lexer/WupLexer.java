package nl.bytesoflife.wupframe.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for WUP files.
 * Splits the content on the statement terminator into trimmed, non-empty statements.
 */
public class WupLexer {

    public static final char TERMINATOR = ';';

    /**
     * Statement texts in source order. Inner spacing of each statement is preserved.
     */
    public List<String> splitStatements(String content) {
        List<String> statements = new ArrayList<>();
        if (content == null) return statements;

        int start = 0;
        for (int i = 0; i <= content.length(); i++) {
            if (i == content.length() || content.charAt(i) == TERMINATOR) {
                String trimmed = content.substring(start, i).trim();
                if (!trimmed.isEmpty()) {
                    statements.add(trimmed);
                }
                start = i + 1;
            }
        }
        return statements;
    }

    public List<Statement> tokenize(String content) {
        return index(splitStatements(content));
    }

    /**
     * Indexes an existing statement list. Null or blank slots keep their index but yield no
     * statement, so later indices still line up with the list.
     */
    public List<Statement> index(List<String> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            String text = statements.get(i);
            if (text == null || text.isBlank()) continue;
            result.add(Statement.of(i, text.trim()));
        }
        return result;
    }
}
