package nl.bytesoflife.wupframe.spatial;

import nl.bytesoflife.wupframe.geometry.Point;
import nl.bytesoflife.wupframe.model.BoyOperation;
import nl.bytesoflife.wupframe.model.NailRow;
import nl.bytesoflife.wupframe.model.SheathingPanel;
import nl.bytesoflife.wupframe.model.StructuralRect;
import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.model.paf.PafCircle;
import nl.bytesoflife.wupframe.model.paf.PafPath;
import nl.bytesoflife.wupframe.model.paf.PafRouting;
import nl.bytesoflife.wupframe.model.paf.PafSegment;
import org.locationtech.jts.geom.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts model entities to JTS geometries in wall (x, y) coordinates. Drilling operations
 * become points in their own (x, z) plane. Each geometry carries its entity as user data.
 */
public class WupGeometryConverter {

    private static final int DEFAULT_ARC_SEGMENTS = 32;

    private final GeometryFactory factory = new GeometryFactory();
    private final int arcSegments;

    public WupGeometryConverter() {
        this(DEFAULT_ARC_SEGMENTS);
    }

    /**
     * @param arcSegments segments per full circle when buffering circular cuts
     */
    public WupGeometryConverter(int arcSegments) {
        if (arcSegments < 4) {
            throw new IllegalArgumentException("Need at least 4 arc segments, got " + arcSegments);
        }
        this.arcSegments = arcSegments;
    }

    public List<Geometry> convertMembers(WupModel model) {
        List<Geometry> geometries = new ArrayList<>();
        for (StructuralRect rect : model.getStructuralRects()) {
            geometries.add(convertMember(rect));
        }
        return geometries;
    }

    public List<Geometry> convert(WupModel model) {
        List<Geometry> geometries = convertMembers(model);
        for (SheathingPanel panel : model.getSheathing()) {
            geometries.add(convertPanel(panel));
        }
        for (NailRow row : model.getNailRows()) {
            geometries.add(convertNailRow(row));
        }
        for (PafRouting routing : model.getPafRoutings()) {
            geometries.addAll(convertRouting(routing));
        }
        return geometries;
    }

    public Geometry convertMember(StructuralRect rect) {
        Geometry geometry = rectangle(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight());
        geometry.setUserData(rect);
        return geometry;
    }

    /**
     * The boundary points when there are at least three, the panel rectangle otherwise.
     */
    public Geometry convertPanel(SheathingPanel panel) {
        Geometry geometry;
        List<SheathingPanel.PanelPoint> points = panel.getPoints();
        if (points.size() >= 3) {
            List<Coordinate> coords = new ArrayList<>();
            for (SheathingPanel.PanelPoint point : points) {
                coords.add(new Coordinate(point.x(), point.y()));
            }
            geometry = polygon(coords);
        } else {
            geometry = rectangle(panel.getX(), panel.getY(), panel.getWidth(), panel.getHeight());
        }
        geometry.setUserData(panel);
        return geometry;
    }

    public Geometry convertNailRow(NailRow row) {
        Geometry geometry = factory.createLineString(new Coordinate[]{
                coordinate(row.getStart()),
                coordinate(row.getEnd())
        });
        geometry.setUserData(row);
        return geometry;
    }

    public List<Geometry> convertRouting(PafRouting routing) {
        List<Geometry> geometries = new ArrayList<>();
        for (PafSegment segment : routing.getSegments()) {
            Geometry geometry = convertSegment(segment);
            if (geometry != null && !geometry.isEmpty()) {
                geometry.setUserData(routing);
                geometries.add(geometry);
            }
        }
        return geometries;
    }

    Geometry convertSegment(PafSegment segment) {
        if (segment instanceof PafCircle circle) {
            return factory.createPoint(coordinate(circle.getCenter()))
                    .buffer(circle.getRadius(), arcSegments / 4);
        } else if (segment instanceof PafPath path) {
            List<Coordinate> coords = new ArrayList<>();
            for (Point point : path.getPoints()) {
                coords.add(coordinate(point));
            }
            if (path.isClosed()) {
                return polygon(coords);
            }
            return factory.createLineString(coords.toArray(new Coordinate[0]));
        }
        return null;
    }

    public Geometry convertBoy(BoyOperation op) {
        Geometry geometry = factory.createPoint(new Coordinate(op.getX(), op.getZ()));
        geometry.setUserData(op);
        return geometry;
    }

    private Geometry rectangle(double x, double y, double width, double height) {
        return factory.createPolygon(new Coordinate[]{
                new Coordinate(x, y),
                new Coordinate(x + width, y),
                new Coordinate(x + width, y + height),
                new Coordinate(x, y + height),
                new Coordinate(x, y)
        });
    }

    private Geometry polygon(List<Coordinate> coords) {
        List<Coordinate> ring = new ArrayList<>(coords);
        Coordinate first = ring.get(0);
        Coordinate last = ring.get(ring.size() - 1);
        if (first.x != last.x || first.y != last.y) {
            ring.add(new Coordinate(first.x, first.y));
        }
        return factory.createPolygon(ring.toArray(new Coordinate[0]));
    }

    private static Coordinate coordinate(Point point) {
        return new Coordinate(point.x(), point.y());
    }
}
