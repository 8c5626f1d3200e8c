package nl.bytesoflife.wupframe.spatial;

import nl.bytesoflife.wupframe.model.MemberKind;
import nl.bytesoflife.wupframe.model.StructuralRect;
import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.parser.WupParser;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SpatialIndexTest {

    private static final String FRAME = """
            UG 2400,45,0,0,0,0;
            QS 2600,45,0,0,45,0;
            QS 2600,45,0,600,45,0;
            LS 555,45,0,45,1200,0;
            """;

    private final GeometryFactory factory = new GeometryFactory();

    private SpatialIndex index() {
        WupModel model = new WupParser().parse(FRAME);
        return SpatialIndex.ofMembers(model, new WupGeometryConverter());
    }

    @Test
    void findsMemberUnderPoint() {
        List<StructuralRect> hits = index().membersContaining(20, 1000, 0);

        assertEquals(1, hits.size());
        assertEquals(MemberKind.STUD, hits.get(0).getKind());
        assertEquals(0, hits.get(0).getX());
    }

    @Test
    void junctionTouchesBothMembers() {
        Set<MemberKind> kinds = index().membersContaining(600, 1220, 0).stream()
                .map(StructuralRect::getKind).collect(Collectors.toSet());

        assertEquals(Set.of(MemberKind.STUD, MemberKind.BLOCKING), kinds);
    }

    @Test
    void toleranceReachesNearbyMembers() {
        SpatialIndex index = index();

        assertTrue(index.membersContaining(300, 1000, 5).isEmpty());
        assertEquals(1, index.membersContaining(300, 1260, 20).size());
    }

    @Test
    void neighborsAreFilteredByDistance() {
        SpatialIndex index = index();
        Geometry probe = factory.createPoint(new Coordinate(2000, 100));

        // 55 mm above the bottom plate
        assertEquals(0, index.queryNeighbors(probe, 50).size());
        assertEquals(1, index.queryNeighbors(probe, 60).size());
        assertEquals(4, index.size());
    }

    @Test
    void noInsertsAfterFirstQuery() {
        SpatialIndex index = index();
        index.membersContaining(0, 0, 0);

        assertThrows(IllegalStateException.class, () -> index.insert(factory.createPoint(new Coordinate(1, 1))));
    }
}
