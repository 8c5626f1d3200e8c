package nl.bytesoflife.wupframe.editor;

import nl.bytesoflife.wupframe.model.Axis;
import nl.bytesoflife.wupframe.model.BoyOperation;
import nl.bytesoflife.wupframe.model.EditableEntity;
import nl.bytesoflife.wupframe.model.EntityKind;
import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.model.paf.PafPath;
import nl.bytesoflife.wupframe.parser.WupParseException;
import nl.bytesoflife.wupframe.parser.WupParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class WupEditorTest {

    private ModelHandle handle;
    private WupEditor editor;

    @BeforeEach
    void setUp() throws IOException {
        String text;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/outlet-wall.wup")) {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        handle = new ModelHandle(new WupParser().parse(text));
        editor = new WupEditor(handle);
    }

    @Test
    void translateNailRowRewritesItsStatement() {
        WupModel before = handle.get();

        EditResult result = editor.translate(EntityKind.NAIL_ROW, Axis.X, 10, 2);

        assertTrue(result.applied());
        assertEquals(1, result.affected());
        assertEquals(1, handle.getGeneration());
        assertSame(result.model(), handle.get());
        assertEquals("NR 32.5,100,32.5,2500,75,2.8", handle.get().getStatement(15));
        assertEquals(32.5, handle.get().getNailRows().get(0).getStart().x());
        // the previous snapshot is untouched
        assertEquals("NR 22.5,100,22.5,2500,75,2.8", before.getStatement(15));
        assertEquals(22.5, before.getNailRows().get(0).getStart().x());
    }

    @Test
    void translateDrillingThroughTheWall() {
        EditResult result = editor.translate(EntityKind.BOY, Axis.Z, 5, 1);

        assertTrue(result.applied());
        assertEquals("BOY 22,35,20,-25", handle.get().getStatement(6));
        BoyOperation op = handle.get().getBoyOperations().get(0);
        assertEquals(35, op.getZ(), 1e-9);
        assertEquals(35, op.getLocalZ(), 1e-9);
        assertEquals(67, op.getX(), 1e-9);
    }

    @Test
    void drillingCannotMoveUpTheWall() {
        WupModel before = handle.get();

        EditResult result = editor.translate(EntityKind.BOY, Axis.Y, 5, 1);

        assertFalse(result.applied());
        assertSame(before, handle.get());
        assertEquals(0, handle.getGeneration());
    }

    @Test
    void translateRoutingRewritesEveryStatement() {
        EditResult result = editor.translate(EntityKind.PAF, Axis.Y, -100, 4);

        assertTrue(result.applied());
        WupModel model = handle.get();
        assertEquals("PAF 2,1,1", model.getStatement(17));
        assertEquals("PP 300,200,-12.5,311,0", model.getStatement(18));
        assertEquals("PP 371,271,-12.5,311,0", model.getStatement(20));
        assertEquals("PP 300,200,-12.5,311,0", model.getStatement(22));
        assertEquals("MP 800,1000,34,-12.5,311", model.getStatement(24));

        PafPath path = (PafPath) model.getPafRoutings().get(0).getSegments().get(0);
        assertEquals(200, path.getPoints().get(0).y(), 1e-9);
        assertEquals(4, model.getPafRoutings().get(0).getEditorId());
    }

    @Test
    void translateSeveralAtOnce() {
        EditResult result = editor.translate(EntityKind.NAIL_ROW, Axis.Y, 2.5, 2, 3, 99);

        assertEquals(2, result.affected());
        assertEquals("NR 622.5,102.5,622.5,2502.5,75,2.8", handle.get().getStatement(16));
    }

    @Test
    void unknownIdIsNoOp() {
        WupModel before = handle.get();

        EditResult result = editor.translate(EntityKind.PAF, Axis.X, 10, 1);

        assertFalse(result.applied());
        assertSame(before, result.model());
        assertSame(before, handle.get());
        assertFalse(editor.delete(EntityKind.NAIL_ROW, 42).applied());
    }

    @Test
    void zeroOrInvalidDistanceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> editor.translate(EntityKind.NAIL_ROW, Axis.X, 0, 2));
        assertThrows(IllegalArgumentException.class,
                () -> editor.translate(EntityKind.NAIL_ROW, Axis.X, Double.NaN, 2));
    }

    @Test
    void deleteBlanksEveryStatementOfTheEntity() {
        EditResult result = editor.delete(EntityKind.PAF, 4);

        assertTrue(result.applied());
        WupModel model = handle.get();
        for (int i = 17; i <= 22; i++) {
            assertNull(model.getStatement(i));
        }
        assertEquals(1, model.getPafRoutings().size());
        assertEquals(6, model.getPafRoutings().get(0).getEditorId());
        assertEquals(26, model.getStatementCount());
    }

    @Test
    void deleteNailRowAndReparse() {
        editor.delete(EntityKind.NAIL_ROW, 3);
        assertNull(handle.get().getStatement(16));

        EditResult result = editor.reparse();

        WupModel model = result.model();
        assertEquals(25, model.getStatementCount());
        assertEquals(1, model.getNailRows().size());
        assertEquals(2, handle.getGeneration());
        // ids continue after the previous model
        for (EditableEntity entity : model.getEditableEntities()) {
            assertTrue(entity.getEditorId() >= 7, entity.toString());
        }
    }

    @Test
    void replaceStatementsReparsesWithFreshIds() {
        EditResult result = editor.replaceStatements(List.of(25), List.of("BOY 10,20,12,15", "BOY 50,20,12,15"));

        assertTrue(result.applied());
        WupModel model = handle.get();
        assertEquals(27, model.getStatementCount());
        assertEquals(3, model.getBoyOperations().size());
        assertEquals(50, model.getBoyOperations().get(2).getX(), 1e-9);

        Set<Integer> ids = model.getEditableEntities().stream()
                .map(EditableEntity::getEditorId).collect(Collectors.toSet());
        assertEquals(7, ids.size());
        assertEquals(IntStream.rangeClosed(7, 13).boxed().collect(Collectors.toSet()), new HashSet<>(ids));
    }

    @Test
    void replaceWithOutOfRangeIndicesIsNoOp() {
        EditResult result = editor.replaceStatements(List.of(-1, 400), List.of("BOY 1,1,1,1"));

        assertFalse(result.applied());
        assertEquals(0, handle.getGeneration());
    }

    @Test
    void replacingEverythingWithNothingFails() {
        List<Integer> all = IntStream.range(0, handle.get().getStatementCount()).boxed().toList();

        WupParseException e = assertThrows(WupParseException.class, () -> editor.replaceStatements(all, List.of()));
        assertEquals("No statements left to parse", e.getMessage());
        assertEquals(0, handle.getGeneration());
    }
}
