package nl.bytesoflife.wupframe.lexer;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WupLexerTest {

    private final WupLexer lexer = new WupLexer();

    @Test
    void splitsOnTerminatorAndDropsEmptyPieces() {
        List<String> statements = lexer.splitStatements("ELM 1200,2400;\n\n  QS 2400,38,0,100,0,0 ;;;  ENDMODUL");

        assertEquals(List.of("ELM 1200,2400", "QS 2400,38,0,100,0,0", "ENDMODUL"), statements);
    }

    @Test
    void keepsInnerSpacing() {
        List<String> statements = lexer.splitStatements("PLI1 1200, 2400,  12.5 ,0,0,3, OSB 3;");

        assertEquals("PLI1 1200, 2400,  12.5 ,0,0,3, OSB 3", statements.get(0));
    }

    @Test
    void nullContentYieldsNoStatements() {
        assertTrue(lexer.splitStatements(null).isEmpty());
        assertTrue(lexer.tokenize("  ;  ; ").isEmpty());
    }

    @Test
    void tokenizeSplitsCommandAndBody() {
        List<Statement> statements = lexer.tokenize("BOY 19,45,20,-20;ENDMODUL;");

        assertEquals(2, statements.size());
        assertEquals("BOY", statements.get(0).command());
        assertEquals("19,45,20,-20", statements.get(0).body());
        assertEquals(WupCommand.BOY, statements.get(0).kind());
        assertEquals("ENDMODUL", statements.get(1).command());
        assertEquals("", statements.get(1).body());
        assertEquals(1, statements.get(1).index());
    }

    @Test
    void indexSkipsDeletedSlotsButKeepsPositions() {
        List<Statement> statements = lexer.index(Arrays.asList("ELM 1,2", null, "  ", "NR 0,0,1,1"));

        assertEquals(2, statements.size());
        assertEquals(0, statements.get(0).index());
        assertEquals(3, statements.get(1).index());
        assertEquals(WupCommand.NR, statements.get(1).kind());
    }

    @Test
    void unknownWordsMapToUnknown() {
        assertEquals(WupCommand.UNKNOWN, Statement.of(0, "XYZ 1,2").kind());
        // command words are case sensitive
        assertEquals(WupCommand.UNKNOWN, WupCommand.fromWord("qs"));
        assertEquals(WupCommand.UNKNOWN, WupCommand.fromWord(null));
    }
}
