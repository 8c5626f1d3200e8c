package nl.bytesoflife.wupframe.model.paf;

import nl.bytesoflife.wupframe.geometry.Point;
import nl.bytesoflife.wupframe.model.Axis;
import nl.bytesoflife.wupframe.model.Bounds;
import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.parser.WupParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PafRoutingTest {

    private static final String ROUTING = "QS 2400,45,0,0,0,0; PAF 2,1,1; MP 500,500,20,-10,311; "
            + "PP 100,100,-12; PP 200,100,-12; KB 200,200,50,w,-12;";

    private PafRouting parseRouting() {
        WupModel model = new WupParser().parse(ROUTING);
        return model.getPafRoutings().get(0);
    }

    @Test
    void headerValues() {
        PafRouting routing = parseRouting();

        assertEquals(2.0, routing.getTool());
        assertEquals(1.0, routing.getFace());
        assertEquals(1.0, routing.getPasses());
        assertEquals(2, routing.getSegments().size());
        assertEquals(List.of(1, 2, 3, 4, 5), routing.getStatementIndices());
    }

    @Test
    void translateMovesEveryCut() {
        PafRouting routing = parseRouting();

        assertTrue(routing.translate(Axis.Y, 10));

        PafCircle circle = (PafCircle) routing.getSegments().get(0);
        assertEquals(new Point(500, 510), circle.getCenter());
        assertEquals(510, circle.getSource()[1]);
        PafPath path = (PafPath) routing.getSegments().get(1);
        assertEquals(new Point(100, 110), path.getSources().get(0).target());
        assertEquals(new Point(200, 210), path.getPathSegments().get(1).to());
        assertEquals(-12, path.getDepthRaw(), 1e-9);
    }

    @Test
    void cannotMoveThroughTheWall() {
        assertFalse(parseRouting().translate(Axis.Z, 10));
    }

    @Test
    void copyDoesNotShareSegmentList() {
        PafRouting routing = parseRouting();
        PafRouting copy = routing.copy();

        copy.translate(Axis.X, 100);

        assertEquals(new Point(500, 500), ((PafCircle) routing.getSegments().get(0)).getCenter());
        assertEquals(routing.getEditorId(), copy.getEditorId());
    }

    @Test
    void circleBounds() {
        Bounds bounds = new Bounds();
        new PafCircle(0, new double[]{500, 500, -20}).extendBounds(bounds);

        assertEquals(480, bounds.getMinX());
        assertEquals(520, bounds.getMaxY());
        assertNull(new PafCircle(0, new double[]{0, 0, 1}).getDepth());
        assertThrows(IllegalArgumentException.class, () -> new PafCircle(0, new double[]{1, 2}));
    }
}
