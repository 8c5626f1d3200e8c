package nl.bytesoflife.wupframe.model.paf;

import nl.bytesoflife.wupframe.geometry.AssembledPath;
import nl.bytesoflife.wupframe.geometry.PathAssembler;
import nl.bytesoflife.wupframe.geometry.PathCommand;
import nl.bytesoflife.wupframe.geometry.PathSegment;
import nl.bytesoflife.wupframe.geometry.Point;
import nl.bytesoflife.wupframe.model.Bounds;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Polygon or polyline cut assembled from a run of {@code PP}/{@code KB} statements.
 */
public class PafPath extends PafSegment {

    private static final PathAssembler ASSEMBLER = new PathAssembler();

    private final Kind kind;
    private final List<Point> points;
    private final List<Point> sampledPoints;
    private final List<PathSegment> pathSegments;
    private final List<PathSource> sources;
    private final CutParameters parameters;

    public PafPath(AssembledPath path, List<PathSource> sources, CutParameters parameters) {
        this(toKind(path.kind()), path.points(), path.sampledPoints(), path.pathSegments(), sources, parameters);
    }

    private PafPath(Kind kind, List<Point> points, List<Point> sampledPoints, List<PathSegment> pathSegments,
                    List<PathSource> sources, CutParameters parameters) {
        this.kind = kind;
        this.points = List.copyOf(points);
        this.sampledPoints = List.copyOf(sampledPoints);
        this.pathSegments = List.copyOf(pathSegments);
        this.sources = List.copyOf(sources);
        this.parameters = parameters != null ? parameters : CutParameters.NONE;
    }

    private static Kind toKind(AssembledPath.Kind kind) {
        return switch (kind) {
            case POLYGON -> Kind.POLYGON;
            case POLYLINE -> Kind.POLYLINE;
            case EMPTY -> throw new IllegalArgumentException("An empty path is not a cut");
        };
    }

    @Override
    public Kind getKind() {
        return kind;
    }

    public boolean isClosed() {
        return kind == Kind.POLYGON;
    }

    /**
     * De-duplicated outline; a polygon does not repeat its first point.
     */
    public List<Point> getPoints() {
        return points;
    }

    public List<PathSegment> getPathSegments() {
        return pathSegments;
    }

    public List<PathSource> getSources() {
        return sources;
    }

    public CutParameters getParameters() {
        return parameters;
    }

    @Override
    public List<Integer> getStatementIndices() {
        List<Integer> indices = new ArrayList<>();
        for (PathSource source : sources) {
            indices.add(source.statementIndex());
        }
        return indices;
    }

    @Override
    public Double getDepth() {
        return parameters.depth();
    }

    @Override
    public Double getDepthRaw() {
        return parameters.depthRaw();
    }

    public Double getOffset() {
        return parameters.offset();
    }

    @Override
    public Double getOrientation() {
        return parameters.orientation();
    }

    public Double getZ() {
        return parameters.z();
    }

    @Override
    public Integer getControlCode() {
        return parameters.controlCode();
    }

    @Override
    public void extendBounds(Bounds bounds) {
        for (Point point : sampledPoints) {
            bounds.extend(point);
        }
    }

    /**
     * Moves every source vertex and re-assembles the outline from the moved sources.
     */
    @Override
    public PafPath translate(double dx, double dy) {
        List<PathSource> movedSources = new ArrayList<>();
        for (PathSource source : sources) {
            movedSources.add(source.translate(dx, dy));
        }
        return rebuild(movedSources);
    }

    private PafPath rebuild(List<PathSource> newSources) {
        List<PathCommand> commands = new ArrayList<>();
        for (int i = 0; i < newSources.size(); i++) {
            commands.add(newSources.get(i).toPathCommand(i == 0));
        }
        AssembledPath path = ASSEMBLER.assemble(commands);
        if (path.isEmpty()) {
            throw new IllegalStateException("Path collapsed while rebuilding " + this);
        }
        return new PafPath(path, newSources, parameters);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "PafPath[%s, %d points, depth=%s]", kind, points.size(), getDepth());
    }
}
