package shadow.postgis;

import org.junit.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;

import static org.junit.Assert.*;

public class RefTest {

    @Test
    public void testSet() {
        Point p = new GeometryFactory().createPoint(new Coordinate(1, 2));

        Ref<Geometry> ref = Ref.to(Geometry.class);
        assertNull(ref.get());
        assertEquals(Geometry.class, ref.getType());

        ref.set(p);
        assertSame(p, ref.get());
    }

    @Test(expected = ClassCastException.class)
    public void testSetWrongType() {
        Ref<Point> ref = Ref.to(Point.class);
        ref.set("POINT(1 2)");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTypeRequired() {
        Ref.to(null);
    }
}
