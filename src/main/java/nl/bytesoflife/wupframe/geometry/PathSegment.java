package nl.bytesoflife.wupframe.geometry;

/**
 * One piece of an assembled routing path.
 */
public sealed interface PathSegment permits LineSegment, ArcSegment {

    Point from();

    Point to();

    PathSegment translate(double dx, double dy);
}
