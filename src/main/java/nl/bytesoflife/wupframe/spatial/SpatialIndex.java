package nl.bytesoflife.wupframe.spatial;

import nl.bytesoflife.wupframe.model.StructuralRect;
import nl.bytesoflife.wupframe.model.WupModel;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * STR-tree over converted geometries, answering which framing members contain or lie near a
 * point or a geometry. The tree is built on the first query; no inserts after that.
 */
public class SpatialIndex {

    private final STRtree tree = new STRtree();
    private final GeometryFactory factory = new GeometryFactory();
    private boolean built = false;
    private int size;

    public static SpatialIndex ofMembers(WupModel model, WupGeometryConverter converter) {
        SpatialIndex index = new SpatialIndex();
        index.insertAll(converter.convertMembers(model));
        return index;
    }

    public void insert(Geometry geometry) {
        if (built) {
            throw new IllegalStateException("Spatial index is already built");
        }
        tree.insert(geometry.getEnvelopeInternal(), geometry);
        size++;
    }

    public void insertAll(List<Geometry> geometries) {
        for (Geometry geom : geometries) {
            insert(geom);
        }
    }

    public int size() {
        return size;
    }

    /**
     * Geometries within {@code searchDistance} of the given one.
     */
    @SuppressWarnings("unchecked")
    public List<Geometry> queryNeighbors(Geometry geometry, double searchDistance) {
        ensureBuilt();
        Envelope searchEnvelope = geometry.getEnvelopeInternal().copy();
        searchEnvelope.expandBy(searchDistance);
        List<Geometry> result = new ArrayList<>();
        for (Geometry candidate : (List<Geometry>) tree.query(searchEnvelope)) {
            if (candidate.distance(geometry) <= searchDistance) {
                result.add(candidate);
            }
        }
        return result;
    }

    public List<StructuralRect> membersNear(Geometry geometry, double distance) {
        List<StructuralRect> members = new ArrayList<>();
        for (Geometry candidate : queryNeighbors(geometry, distance)) {
            if (candidate.getUserData() instanceof StructuralRect rect) {
                members.add(rect);
            }
        }
        return members;
    }

    /**
     * Members whose outline contains the point, allowing {@code tolerance} mm outside it.
     */
    public List<StructuralRect> membersContaining(double x, double y, double tolerance) {
        return membersNear(factory.createPoint(new Coordinate(x, y)), Math.max(tolerance, 0));
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }
}
