package nl.bytesoflife.wupframe.cli;

import nl.bytesoflife.wupframe.editor.EditResult;
import nl.bytesoflife.wupframe.editor.ModelHandle;
import nl.bytesoflife.wupframe.editor.WupEditor;
import nl.bytesoflife.wupframe.editor.WupFiles;
import nl.bytesoflife.wupframe.model.Axis;
import nl.bytesoflife.wupframe.model.EntityKind;
import nl.bytesoflife.wupframe.model.NailRow;
import nl.bytesoflife.wupframe.model.StructuralRect;
import nl.bytesoflife.wupframe.model.UnhandledStatement;
import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.model.paf.CutoutFootprint;
import nl.bytesoflife.wupframe.model.paf.PafControlCode;
import nl.bytesoflife.wupframe.model.paf.PafPath;
import nl.bytesoflife.wupframe.model.paf.PafRouting;
import nl.bytesoflife.wupframe.model.paf.PafSegment;
import nl.bytesoflife.wupframe.parser.WupParser;
import nl.bytesoflife.wupframe.spatial.SpatialIndex;
import nl.bytesoflife.wupframe.spatial.WupGeometryConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point: prints a summary of a WUP file and optionally applies one edit,
 * saving the result next to the input.
 * <pre>
 * WupInspect file.wup
 * WupInspect file.wup translate (nr|boy|paf) id (x|y|z) mm
 * WupInspect file.wup delete (nr|boy|paf) id
 * </pre>
 * {@code -Dwup.out=path} overrides the output file, {@code -Dwup.suffix=-edited} the name suffix.
 */
public class WupInspect {

    private static final Logger log = LoggerFactory.getLogger(WupInspect.class);

    private final PrintStream out;

    public WupInspect(PrintStream out) {
        this.out = out;
    }

    public int run(String[] args) throws IOException {
        if (args.length < 1) {
            out.println("Usage: WupInspect <file.wup> [translate <nr|boy|paf> <id> <x|y|z> <mm> | delete <nr|boy|paf> <id>]");
            return 2;
        }
        Path input = Paths.get(args[0]);
        WupModel model;
        try (InputStream in = Files.newInputStream(input)) {
            model = new WupParser().parse(in);
        }
        printSummary(model);

        if (args.length == 1) {
            return 0;
        }

        ModelHandle handle = new ModelHandle(model);
        WupEditor editor = new WupEditor(handle);
        EditResult result = switch (args[1].toLowerCase(Locale.ROOT)) {
            case "translate" -> {
                requireArgs(args, 6);
                yield editor.translate(EntityKind.fromName(args[2]), Axis.fromName(args[4]),
                        Double.parseDouble(args[5]), Integer.parseInt(args[3]));
            }
            case "delete" -> {
                requireArgs(args, 4);
                yield editor.delete(EntityKind.fromName(args[2]), Integer.parseInt(args[3]));
            }
            default -> throw new IllegalArgumentException("Unknown edit: " + args[1]);
        };
        out.println(result.message());
        if (!result.applied()) {
            return 1;
        }

        String target = System.getProperty("wup.out");
        Path written = target != null
                ? WupFiles.save(handle.get(), input, Paths.get(target))
                : WupFiles.saveAsModified(handle.get(), input, System.getProperty("wup.suffix", WupFiles.DEFAULT_SUFFIX));
        out.println("Saved " + written);
        return 0;
    }

    void printSummary(WupModel model) {
        double[] view = model.viewSize();
        out.printf(Locale.US, "Wall %.1f x %.1f mm, %s%n", view[0], view[1], model.getBounds());
        out.printf("Studs %d, blocking %d, plates %d, sheathing %d, nail rows %d, BOY %d, PAF %d, unhandled %d%n",
                model.getStuds().size(), model.getBlocking().size(), model.getPlates().size(),
                model.getSheathing().size(), model.getNailRows().size(), model.getBoyOperations().size(),
                model.getPafRoutings().size(), model.getUnhandled().size());

        SpatialIndex members = SpatialIndex.ofMembers(model, new WupGeometryConverter());
        for (NailRow row : model.getNailRows()) {
            List<StructuralRect> hit = members.membersContaining(row.getStart().x(), row.getStart().y(), 0.5);
            out.printf(Locale.US, "  NR #%d %s -> %s, %.1f mm, %d member(s) at start%n",
                    row.getEditorId(), row.getStart(), row.getEnd(), row.getLength(), hit.size());
        }
        model.getBoyOperations().forEach(op -> out.printf(Locale.US, "  BOY #%d x=%.1f z=%.1f, direction %d, %s%n",
                op.getEditorId(), op.getX(), op.getZ(), op.getDirection(model.getWall()),
                op.getTarget() != null ? op.getTarget().kind() : "no target"));
        for (PafRouting routing : model.getPafRoutings()) {
            out.printf("  PAF #%d, %d cut(s), layer %s%n", routing.getEditorId(), routing.getSegments().size(),
                    routing.getLayer() != null ? routing.getLayer() : "-");
            for (PafSegment segment : routing.getSegments()) {
                PafControlCode code = PafControlCode.of(segment);
                out.printf("    %s code %s (%s, %s)", segment.getKind(), code.isValid() ? code.code() : "-",
                        code.getToolCategory().getLabel(), code.getCompensation());
                if (segment instanceof PafPath path) {
                    CutoutFootprint footprint = CutoutFootprint.of(path);
                    if (footprint != null) {
                        out.printf(Locale.US, " footprint %.1f x %.1f", footprint.width(), footprint.height());
                    }
                }
                out.println();
            }
        }
        for (UnhandledStatement statement : model.getUnhandled()) {
            out.println("  unhandled " + statement);
        }
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new IllegalArgumentException("Expected " + (count - 2) + " arguments after " + args[1]);
        }
    }

    public static void main(String[] args) {
        Locale.setDefault(Locale.US);
        int status;
        try {
            status = new WupInspect(System.out).run(args);
        } catch (Exception e) {
            log.error("Failed to process {}", args.length > 0 ? args[0] : "input", e);
            status = 1;
        }
        System.exit(status);
    }
}
