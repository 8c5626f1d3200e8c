package nl.bytesoflife.wupframe.editor;

import nl.bytesoflife.wupframe.model.Axis;
import nl.bytesoflife.wupframe.model.BoyOperation;
import nl.bytesoflife.wupframe.model.EditableEntity;
import nl.bytesoflife.wupframe.model.EntityKind;
import nl.bytesoflife.wupframe.model.NailRow;
import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.model.paf.PafRouting;
import nl.bytesoflife.wupframe.parser.WupParseException;
import nl.bytesoflife.wupframe.parser.WupParser;
import nl.bytesoflife.wupframe.serializer.SerializedWup;
import nl.bytesoflife.wupframe.serializer.StatementFormatter;
import nl.bytesoflife.wupframe.serializer.WupSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Moves and deletes nail rows, drilling operations and routings, and replaces statements.
 * Every edit works on a copy of the current model and swaps it into the {@link ModelHandle}
 * only when something changed. Entities that cannot be found are skipped with a warning.
 */
public class WupEditor {

    private static final Logger log = LoggerFactory.getLogger(WupEditor.class);

    private final ModelHandle handle;
    private final WupSerializer serializer = new WupSerializer();

    public WupEditor(ModelHandle handle) {
        this.handle = handle;
    }

    public WupModel getModel() {
        return handle.get();
    }

    /**
     * Moves the given entities by {@code mm} along {@code axis} and rewrites their statements.
     * Nail rows and routings move along X or Y, drilling operations along X or Z.
     */
    public EditResult translate(EntityKind kind, Axis axis, double mm, int... editorIds) {
        if (!Double.isFinite(mm) || mm == 0) {
            throw new IllegalArgumentException("Distance must be a non-zero number of millimetres, got " + mm);
        }
        WupModel current = handle.get();
        WupModel working = current.copy();
        working.ensureEditorIds();

        int moved = 0;
        for (int editorId : editorIds) {
            EditableEntity entity = working.findById(kind, editorId);
            if (entity == null) {
                log.warn("No {} with id {}, not translating", kind, editorId);
                continue;
            }
            if (translate(working, entity, axis, mm)) {
                moved++;
            } else {
                log.warn("{} #{} cannot move along {}", kind, editorId, axis);
            }
        }

        if (moved == 0) {
            return EditResult.noOp(current, "No selected items support translation along " + axis);
        }
        return commit(working, moved, String.format("Moved %d item%s %s mm along %s",
                moved, moved == 1 ? "" : "s", StatementFormatter.formatNumber(mm), axis));
    }

    private boolean translate(WupModel working, EditableEntity entity, Axis axis, double mm) {
        if (entity instanceof NailRow row) {
            if (!row.translate(axis, mm)) return false;
            working.setStatement(row.getStatementIndex(), StatementFormatter.nailRow(row));
        } else if (entity instanceof BoyOperation op) {
            if (!op.translate(axis, mm)) return false;
            working.setStatement(op.getStatementIndex(), StatementFormatter.boy(op));
        } else if (entity instanceof PafRouting routing) {
            if (routing.getSegments().isEmpty() || !routing.translate(axis, mm)) return false;
            for (Map.Entry<Integer, String> statement : StatementFormatter.routing(routing).entrySet()) {
                working.setStatement(statement.getKey(), statement.getValue());
            }
        } else {
            return false;
        }
        return true;
    }

    /**
     * Removes the given entities and blanks every statement they came from.
     */
    public EditResult delete(EntityKind kind, int... editorIds) {
        WupModel current = handle.get();
        WupModel working = current.copy();
        working.ensureEditorIds();

        int removed = 0;
        for (int editorId : editorIds) {
            EditableEntity entity = working.findById(kind, editorId);
            if (entity == null || !working.remove(entity)) {
                log.warn("No {} with id {}, not deleting", kind, editorId);
                continue;
            }
            for (int index : entity.getStatementIndices()) {
                working.setStatement(index, null);
            }
            removed++;
        }

        if (removed == 0) {
            return EditResult.noOp(current, "Nothing deleted");
        }
        return commit(working, removed, String.format("Deleted %d item%s", removed, removed == 1 ? "" : "s"));
    }

    /**
     * Removes the statements at {@code indices}, inserts {@code replacements} where the first
     * of them was, and re-parses the whole document. Ids continue from the current counter.
     * Indices outside the statement list are ignored; if none is left the edit is a no-op.
     */
    public EditResult replaceStatements(Collection<Integer> indices, List<String> replacements) {
        WupModel current = handle.get();
        TreeSet<Integer> removed = new TreeSet<>();
        for (Integer index : indices) {
            if (index != null && index >= 0 && index < current.getStatementCount()) {
                removed.add(index);
            } else {
                log.warn("Statement index {} out of range, ignored", index);
            }
        }
        if (removed.isEmpty()) {
            return EditResult.noOp(current, "No statements to replace");
        }

        List<String> statements = new ArrayList<>();
        int insertAt = removed.first();
        for (int i = 0; i < current.getStatementCount(); i++) {
            if (i == insertAt) {
                statements.addAll(replacements);
            }
            if (!removed.contains(i)) {
                statements.add(current.getStatement(i));
            }
        }

        WupModel reparsed = parse(statements, current);
        return commit(reparsed, removed.size(), String.format("Replaced %d statement%s with %d",
                removed.size(), removed.size() == 1 ? "" : "s", replacements.size()));
    }

    /**
     * Parses the current statement list again, as a fresh model with continued ids.
     */
    public EditResult reparse() {
        WupModel current = handle.get();
        WupModel reparsed = parse(current.getStatements(), current);
        return commit(reparsed, 0, "Re-parsed");
    }

    private WupModel parse(List<String> statements, WupModel current) {
        SerializedWup serialized = serializer.serialize(statements, current.getSourceText());
        if (serialized.isEmpty()) {
            throw new WupParseException("No statements left to parse");
        }
        return new WupParser()
                .setFirstEditorId(current.getNextEditorId())
                .parse(serialized.text());
    }

    private EditResult commit(WupModel next, int affected, String message) {
        next.recalculateBounds();
        handle.swap(next);
        log.info("{} (generation {})", message, handle.getGeneration());
        return EditResult.applied(affected, next, message);
    }
}
