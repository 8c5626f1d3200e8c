package nl.bytesoflife.wupframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for entities the editor can move or delete: nail rows, drilling operations and
 * routings. Each carries an editor id and the indices of the statements that produced it.
 */
public abstract class EditableEntity {

    static final int UNASSIGNED = 0;

    private int editorId = UNASSIGNED;
    private final String command;
    private final List<Integer> statementIndices = new ArrayList<>();

    protected EditableEntity(String command, int statementIndex) {
        this.command = command;
        this.statementIndices.add(statementIndex);
    }

    protected EditableEntity(EditableEntity other) {
        this.editorId = other.editorId;
        this.command = other.command;
        this.statementIndices.addAll(other.statementIndices);
    }

    public abstract EntityKind getEntityKind();

    /**
     * Deep copy keeping the editor id.
     */
    public abstract EditableEntity copy();

    public boolean hasEditorId() {
        return editorId != UNASSIGNED;
    }

    public int getEditorId() {
        return editorId;
    }

    void setEditorId(int editorId) {
        this.editorId = editorId;
    }

    public String getCommand() {
        return command;
    }

    /**
     * Index of the statement that created the entity (the header for routings).
     */
    public int getStatementIndex() {
        return statementIndices.get(0);
    }

    public List<Integer> getStatementIndices() {
        return Collections.unmodifiableList(statementIndices);
    }

    public void addStatementIndex(int index) {
        statementIndices.add(index);
    }
}
