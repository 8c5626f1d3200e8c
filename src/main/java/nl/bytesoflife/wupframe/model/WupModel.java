package nl.bytesoflife.wupframe.model;

import nl.bytesoflife.wupframe.model.paf.PafRouting;
import nl.bytesoflife.wupframe.parser.WupParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Everything parsed from one WUP document, together with the statement list it came from.
 * The statement list is the single source of truth for serialization; a null slot is a
 * deleted statement.
 */
public class WupModel {

    private Wall wall;
    private final List<WallModule> modules = new ArrayList<>();
    private final List<StructuralRect> studs = new ArrayList<>();
    private final List<StructuralRect> blocking = new ArrayList<>();
    private final List<StructuralRect> plates = new ArrayList<>();
    private final List<SheathingPanel> sheathing = new ArrayList<>();
    private final List<NailRow> nailRows = new ArrayList<>();
    private final List<PafRouting> pafRoutings = new ArrayList<>();
    private final List<BoyOperation> boyOperations = new ArrayList<>();
    private final List<UnhandledStatement> unhandled = new ArrayList<>();
    private final List<String> statements = new ArrayList<>();
    private Bounds bounds = new Bounds();
    private String sourceText;
    private int nextEditorId;

    public WupModel(List<String> statements, String sourceText, int firstEditorId) {
        if (firstEditorId < 1) {
            throw new IllegalArgumentException("Editor ids start at 1, got " + firstEditorId);
        }
        this.statements.addAll(statements);
        this.sourceText = sourceText;
        this.nextEditorId = firstEditorId;
    }

    /**
     * Deep copy: editable entities and the statement list are duplicated, the immutable
     * structural parts are shared.
     */
    public WupModel copy() {
        WupModel copy = new WupModel(statements, sourceText, nextEditorId);
        copy.wall = wall;
        copy.modules.addAll(modules);
        copy.studs.addAll(studs);
        copy.blocking.addAll(blocking);
        copy.plates.addAll(plates);
        copy.sheathing.addAll(sheathing);
        copy.unhandled.addAll(unhandled);
        nailRows.forEach(row -> copy.nailRows.add(row.copy()));
        pafRoutings.forEach(routing -> copy.pafRoutings.add(routing.copy()));
        boyOperations.forEach(op -> copy.boyOperations.add(op.copy()));
        copy.bounds = bounds.copy();
        return copy;
    }

    /**
     * Gives the entity the next id unless it already has one.
     */
    public int assignEditorId(EditableEntity entity) {
        if (!entity.hasEditorId()) {
            entity.setEditorId(nextEditorId++);
        }
        return entity.getEditorId();
    }

    public void ensureEditorIds() {
        for (EditableEntity entity : getEditableEntities()) {
            assignEditorId(entity);
        }
    }

    public List<EditableEntity> getEditableEntities() {
        List<EditableEntity> entities = new ArrayList<>();
        entities.addAll(nailRows);
        entities.addAll(boyOperations);
        entities.addAll(pafRoutings);
        return entities;
    }

    /**
     * Returns null when no entity of that kind has the id.
     */
    public EditableEntity findById(EntityKind kind, int editorId) {
        List<? extends EditableEntity> candidates = switch (kind) {
            case NAIL_ROW -> nailRows;
            case BOY -> boyOperations;
            case PAF -> pafRoutings;
        };
        for (EditableEntity entity : candidates) {
            if (entity.getEditorId() == editorId) {
                return entity;
            }
        }
        return null;
    }

    public boolean remove(EditableEntity entity) {
        Predicate<EditableEntity> same = candidate -> candidate == entity;
        return switch (entity.getEntityKind()) {
            case NAIL_ROW -> nailRows.removeIf(same);
            case BOY -> boyOperations.removeIf(same);
            case PAF -> pafRoutings.removeIf(same);
        };
    }

    /**
     * Size of the drawing area: the wall dimensions, or the bounds extent without a wall.
     */
    public double[] viewSize() {
        double width = wall != null ? wall.width() : bounds.getWidth();
        double height = wall != null ? wall.height() : bounds.getHeight();
        if (!Double.isFinite(width) || !Double.isFinite(height)) {
            throw new WupParseException("Invalid wall dimensions: " + width + " x " + height);
        }
        return new double[]{width, height};
    }

    public void recalculateBounds() {
        bounds = Bounds.of(this);
    }

    public String getStatement(int index) {
        return index >= 0 && index < statements.size() ? statements.get(index) : null;
    }

    public void setStatement(int index, String text) {
        if (index < 0 || index >= statements.size()) {
            throw new IndexOutOfBoundsException("No statement " + index + " in a list of " + statements.size());
        }
        statements.set(index, text);
    }

    public List<String> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public int getStatementCount() {
        return statements.size();
    }

    public List<StructuralRect> getStructuralRects() {
        List<StructuralRect> rects = new ArrayList<>(studs);
        rects.addAll(blocking);
        rects.addAll(plates);
        return rects;
    }

    public Wall getWall() {
        return wall;
    }

    public void setWall(Wall wall) {
        this.wall = wall;
    }

    public void addModule(WallModule module) {
        modules.add(module);
    }

    public void addStud(StructuralRect rect) {
        studs.add(rect);
    }

    public void addBlocking(StructuralRect rect) {
        blocking.add(rect);
    }

    public void addPlate(StructuralRect rect) {
        plates.add(rect);
    }

    public void addSheathing(SheathingPanel panel) {
        sheathing.add(panel);
    }

    public void addNailRow(NailRow row) {
        nailRows.add(row);
    }

    public void addPafRouting(PafRouting routing) {
        pafRoutings.add(routing);
    }

    public void addBoyOperation(BoyOperation op) {
        boyOperations.add(op);
    }

    public void addUnhandled(UnhandledStatement statement) {
        unhandled.add(statement);
    }

    public List<WallModule> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public List<StructuralRect> getStuds() {
        return Collections.unmodifiableList(studs);
    }

    public List<StructuralRect> getBlocking() {
        return Collections.unmodifiableList(blocking);
    }

    public List<StructuralRect> getPlates() {
        return Collections.unmodifiableList(plates);
    }

    public List<SheathingPanel> getSheathing() {
        return Collections.unmodifiableList(sheathing);
    }

    public List<NailRow> getNailRows() {
        return Collections.unmodifiableList(nailRows);
    }

    public List<PafRouting> getPafRoutings() {
        return Collections.unmodifiableList(pafRoutings);
    }

    public List<BoyOperation> getBoyOperations() {
        return Collections.unmodifiableList(boyOperations);
    }

    public List<UnhandledStatement> getUnhandled() {
        return Collections.unmodifiableList(unhandled);
    }

    public Bounds getBounds() {
        return bounds;
    }

    public String getSourceText() {
        return sourceText;
    }

    public int getNextEditorId() {
        return nextEditorId;
    }

    @Override
    public String toString() {
        return "WupModel[studs=" + studs.size() + ", blocking=" + blocking.size() + ", plates=" + plates.size()
                + ", sheathing=" + sheathing.size() + ", nailRows=" + nailRows.size()
                + ", boy=" + boyOperations.size() + ", paf=" + pafRoutings.size()
                + ", unhandled=" + unhandled.size() + ", " + bounds + "]";
    }
}
