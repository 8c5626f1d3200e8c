package nl.bytesoflife.wupframe.parser;

import nl.bytesoflife.wupframe.geometry.AssembledPath;
import nl.bytesoflife.wupframe.geometry.PathAssembler;
import nl.bytesoflife.wupframe.geometry.Point;
import nl.bytesoflife.wupframe.lexer.Statement;
import nl.bytesoflife.wupframe.lexer.StatementValues;
import nl.bytesoflife.wupframe.lexer.WupCommand;
import nl.bytesoflife.wupframe.lexer.WupLexer;
import nl.bytesoflife.wupframe.model.BoyOperation;
import nl.bytesoflife.wupframe.model.BoyTarget;
import nl.bytesoflife.wupframe.model.MemberKind;
import nl.bytesoflife.wupframe.model.NailRow;
import nl.bytesoflife.wupframe.model.PanelLayer;
import nl.bytesoflife.wupframe.model.PlateRole;
import nl.bytesoflife.wupframe.model.SheathingPanel;
import nl.bytesoflife.wupframe.model.StructuralRect;
import nl.bytesoflife.wupframe.model.UnhandledStatement;
import nl.bytesoflife.wupframe.model.Wall;
import nl.bytesoflife.wupframe.model.WallModule;
import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.model.paf.PafCircle;
import nl.bytesoflife.wupframe.model.paf.PafPath;
import nl.bytesoflife.wupframe.model.paf.PafRouting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Parser for WUP wall element files.
 * Walks the statements in order, keeping the open module, panel, routing and path in a
 * {@link ParserState}, and builds a {@link WupModel}. Statements that cannot be used are
 * recorded as unhandled instead of failing the parse.
 */
public class WupParser {

    private static final Logger log = LoggerFactory.getLogger(WupParser.class);

    private final WupLexer lexer = new WupLexer();
    private final PathAssembler pathAssembler;
    private int firstEditorId = 1;

    public WupParser() {
        this(new PathAssembler());
    }

    public WupParser(PathAssembler pathAssembler) {
        this.pathAssembler = pathAssembler;
    }

    /**
     * First editor id handed out; a re-parse continues the counter of the model it replaces.
     */
    public WupParser setFirstEditorId(int firstEditorId) {
        if (firstEditorId < 1) {
            throw new IllegalArgumentException("Editor ids start at 1, got " + firstEditorId);
        }
        this.firstEditorId = firstEditorId;
        return this;
    }

    public WupModel parse(InputStream inputStream) throws IOException {
        return parse(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
    }

    public WupModel parse(String content) {
        if (content == null || content.isBlank()) {
            throw new WupParseException("WUP input must be a non-empty string");
        }
        long start = System.currentTimeMillis();

        List<String> texts = lexer.splitStatements(content);
        WupModel model = new WupModel(texts, content, firstEditorId);
        ParserState state = new ParserState();

        for (Statement statement : lexer.index(texts)) {
            log.trace("{}", statement);
            handle(statement, state, model);
        }
        finishRouting(state, model);

        if (model.getBounds().isEmpty()) {
            throw new WupParseException("No frame members detected in the WUP file");
        }

        log.info("Parsed {} statements in {}ms: {} studs, {} blocking, {} plates, {} panels, {} nail rows, "
                        + "{} drillings, {} routings, {} unhandled",
                texts.size(), System.currentTimeMillis() - start,
                model.getStuds().size(), model.getBlocking().size(), model.getPlates().size(),
                model.getSheathing().size(), model.getNailRows().size(), model.getBoyOperations().size(),
                model.getPafRoutings().size(), model.getUnhandled().size());
        return model;
    }

    private void handle(Statement statement, ParserState state, WupModel model) {
        WupCommand command = statement.kind();
        StatementValues values = statement.values();

        if (command != WupCommand.PP) {
            state.clearPanel();
        }
        if (command != WupCommand.PP && command != WupCommand.KB) {
            flushPath(state, model);
        }

        switch (command) {
            case ELM -> handleWall(statement, values, model);
            case MODUL -> handleModule(statement, values, state, model);
            case ENDMODUL -> {
                state.setModule(null);
                state.setLastTarget(null);
            }
            case QS -> handleMember(statement, values, MemberKind.STUD, null, state, model);
            case LS -> handleMember(statement, values, MemberKind.BLOCKING, null, state, model);
            case OG -> handleMember(statement, values, MemberKind.PLATE, PlateRole.TOP, state, model);
            case UG -> handleMember(statement, values, MemberKind.PLATE, PlateRole.BOTTOM, state, model);
            case PAF -> {
                finishRouting(state, model);
                state.setRouting(new PafRouting(statement.index(), values.numbers(), values.body(),
                        state.getPanelLayer()));
            }
            case MP -> handleCircle(statement, values, state, model);
            case PLI1 -> handlePanel(statement, values, PanelLayer.PLI, state, model);
            case PLA1 -> handlePanel(statement, values, PanelLayer.PLA, state, model);
            case PP -> handlePoint(statement, values, state, model);
            case KB -> handleArc(statement, values, state, model);
            case NR -> handleNailRow(statement, values, state, model);
            case BOY -> handleDrilling(statement, values, state, model);
            case UNKNOWN -> {
                finishRouting(state, model);
                unhandled(statement, values, model);
            }
        }
    }

    private void handleWall(Statement statement, StatementValues values, WupModel model) {
        if (!WupCommand.ELM.accepts(values)) {
            unhandled(statement, values, model);
            return;
        }
        model.setWall(new Wall(values.get(0), values.get(1), values.optional(2), values.optional(3)));
    }

    private void handleModule(Statement statement, StatementValues values, ParserState state, WupModel model) {
        if (!WupCommand.MODUL.accepts(values)) {
            unhandled(statement, values, model);
            return;
        }
        WallModule module = new WallModule(values.get(0), values.get(1), values.get(2),
                values.get(3), values.get(4), values.getOrDefault(5, 0));
        model.addModule(module);
        state.setModule(module);
        state.setLastTarget(null);
    }

    private void handleMember(Statement statement, StatementValues values, MemberKind kind, PlateRole role,
                              ParserState state, WupModel model) {
        if (!statement.kind().accepts(values)) {
            unhandled(statement, values, model);
            return;
        }
        // plates are always absolute
        WallModule module = kind == MemberKind.PLATE ? null : state.getModule();
        StructuralRect rect = StructuralRect.fromElement(values.numbers(), kind, role, module,
                values.trailingNumericToken());
        switch (kind) {
            case STUD -> model.addStud(rect);
            case BLOCKING -> model.addBlocking(rect);
            case PLATE -> model.addPlate(rect);
        }
        model.getBounds().extend(rect);
        state.setLastTarget(BoyTarget.of(rect));
    }

    private void handleCircle(Statement statement, StatementValues values, ParserState state, WupModel model) {
        PafRouting routing = state.getRouting();
        if (routing == null || !WupCommand.MP.accepts(values)) {
            unhandled(statement, values, model);
            return;
        }
        PafCircle circle = new PafCircle(statement.index(), values.numbers());
        routing.addSegment(circle);
        routing.addStatementIndex(statement.index());
        circle.extendBounds(model.getBounds());
    }

    private void handlePanel(Statement statement, StatementValues values, PanelLayer layer,
                             ParserState state, WupModel model) {
        // labels such as OSB3 must not contribute digits when the tokens are clean
        double[] tokenNumbers = values.numericTokenValues();
        double[] numbers = tokenNumbers.length >= 6 ? tokenNumbers : values.numbers();
        if (numbers.length < 6) {
            unhandled(statement, values, model);
            return;
        }
        WallModule module = state.getModule();
        double originX = module != null ? module.getOriginX() : 0;
        double originY = module != null ? module.getOriginY() : 0;
        SheathingPanel panel = new SheathingPanel(layer,
                numbers[0], numbers[1], numbers[2],
                originX + numbers[3], originY + numbers[4], numbers[3], numbers[4],
                numbers.length > 6 ? numbers[6] : null,
                numbers.length > 7 ? numbers[7] : 0,
                numbers[5],
                values.firstTextToken());
        model.addSheathing(panel);
        model.getBounds().extendRect(panel.getX(), panel.getY(), panel.getWidth(), panel.getHeight());
        state.setPanel(panel);
        state.setPanelLayer(layer);
    }

    private void handlePoint(Statement statement, StatementValues values, ParserState state, WupModel model) {
        if (!WupCommand.PP.accepts(values)) {
            unhandled(statement, values, model);
            return;
        }
        double[] numbers = values.numbers();
        switch (state.activeContext()) {
            case PANEL -> {
                SheathingPanel panel = state.getPanel();
                WallModule module = state.getModule();
                double x = numbers[0] + (module != null ? module.getOriginX() : 0);
                double y = numbers[1] + (module != null ? module.getOriginY() : 0);
                Double thickness = values.optional(2);
                Double offset = values.optional(3);
                panel.addPoint(new SheathingPanel.PanelPoint(x, y,
                        thickness != null ? thickness : panel.getThickness(),
                        offset != null ? offset : panel.getOffset(),
                        values.numbersFrom(4)));
                model.getBounds().extend(x, y);
            }
            case ROUTING -> {
                Point vertex = new Point(numbers[0], numbers[1]);
                if (!vertex.isFinite()) {
                    unhandled(statement, values, model);
                    return;
                }
                state.path().addPoint(statement.index(), numbers);
                state.getRouting().addStatementIndex(statement.index());
                model.getBounds().extend(vertex);
            }
            case NONE -> unhandled(statement, values, model);
        }
    }

    private void handleArc(Statement statement, StatementValues values, ParserState state, WupModel model) {
        PafRouting routing = state.getRouting();
        String arcType = values.token(3);
        if (routing == null || !WupCommand.KB.accepts(values) || arcType == null) {
            unhandled(statement, values, model);
            return;
        }
        double[] numbers = values.numbers();
        Point vertex = new Point(numbers[0], numbers[1]);
        if (!vertex.isFinite() || !Double.isFinite(numbers[2])) {
            unhandled(statement, values, model);
            return;
        }
        state.path().addArc(statement.index(), numbers, arcType);
        routing.addStatementIndex(statement.index());
        model.getBounds().extend(vertex);
    }

    private void handleNailRow(Statement statement, StatementValues values, ParserState state, WupModel model) {
        if (!WupCommand.NR.accepts(values)) {
            unhandled(statement, values, model);
            return;
        }
        PanelLayer layer = state.getPanelLayer() != null ? state.getPanelLayer() : PanelLayer.PLI;
        NailRow row = new NailRow(statement.index(), values.numbers(), layer);
        model.assignEditorId(row);
        model.addNailRow(row);
        model.getBounds().extend(row.getStart());
        model.getBounds().extend(row.getEnd());
    }

    /**
     * Local x is relative to the last framing member, else to the module origin; local z is
     * relative to the module origin.
     */
    private void handleDrilling(Statement statement, StatementValues values, ParserState state, WupModel model) {
        if (!WupCommand.BOY.accepts(values)) {
            unhandled(statement, values, model);
            return;
        }
        double[] numbers = values.numbers();
        BoyTarget target = state.getLastTarget();
        WallModule module = state.getModule();

        double baseX = 0;
        if (target != null && target.element() != null) {
            baseX = target.element().getX();
        } else if (module != null) {
            baseX = module.getOriginX();
        }
        double baseZ = module != null ? module.getOriginZ() : 0;

        BoyOperation op = new BoyOperation(statement.index(), numbers, baseX + numbers[0], baseZ + numbers[1], target);
        model.assignEditorId(op);
        model.addBoyOperation(op);
        model.getBounds().extend(op);
    }

    /**
     * Turns the accumulated vertices into a polygon or polyline of the open routing.
     * Fewer than two usable points are dropped.
     */
    private void flushPath(ParserState state, WupModel model) {
        if (!state.hasPath()) {
            return;
        }
        PathAccumulator path = state.takePath();
        PafRouting routing = state.getRouting();
        if (routing == null || path.isEmpty()) {
            return;
        }
        AssembledPath assembled = pathAssembler.assemble(path.toCommands());
        if (assembled.isEmpty()) {
            log.debug("Dropped path of {} vertices without two distinct points", path.getSources().size());
            return;
        }
        PafPath segment = new PafPath(assembled, path.getSources(), path.toParameters());
        routing.addSegment(segment);
        segment.extendBounds(model.getBounds());
    }

    private void finishRouting(ParserState state, WupModel model) {
        flushPath(state, model);
        PafRouting routing = state.getRouting();
        if (routing == null) {
            return;
        }
        if (!routing.getSegments().isEmpty()) {
            model.assignEditorId(routing);
            model.addPafRouting(routing);
        } else {
            log.debug("Routing at statement {} has no cuts", routing.getStatementIndex());
            model.addUnhandled(new UnhandledStatement(routing.getStatementIndex(), "PAF",
                    routing.getHeader(), routing.getBody()));
        }
        state.setRouting(null);
    }

    private void unhandled(Statement statement, StatementValues values, WupModel model) {
        log.debug("Unhandled statement #{}: {}", statement.index(), statement.text());
        model.addUnhandled(new UnhandledStatement(statement.index(), statement.command(),
                values.numbers(), values.body()));
    }
}
