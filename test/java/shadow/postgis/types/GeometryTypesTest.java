package shadow.postgis.types;

import org.junit.Before;
import org.junit.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import shadow.postgis.CommandException;
import shadow.postgis.FormatCode;
import shadow.postgis.PgType;
import shadow.postgis.Ref;
import shadow.postgis.Session;
import shadow.postgis.TypeMap;
import shadow.postgis.WireBuffer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GeometryTypesTest {

    /**
     * answers every query with the same result (or failure)
     */
    static class FakeSession implements Session {
        final TypeMap typeMap = new TypeMap();
        final List<String> queries = new ArrayList<>();

        Object result;
        IOException failure;

        @Override
        public Object queryScalar(String sql) throws IOException {
            queries.add(sql);
            if (failure != null) {
                throw failure;
            }
            return result;
        }

        @Override
        public TypeMap getTypeMap() {
            return typeMap;
        }
    }

    private FakeSession session;

    @Before
    public void setupSession() {
        this.session = new FakeSession();
    }

    @Test
    public void testRegister() throws IOException {
        // oid columns come back as Long from most drivers
        session.result = 16393L;

        PgType type = GeometryTypes.register(session);

        assertEquals("geometry", type.getName());
        assertEquals(16393, type.getOid());
        assertTrue(type.getCodec() instanceof GeometryCodec);

        assertSame(type, session.typeMap.getTypeForOid(16393));
        assertSame(type, session.typeMap.getTypeForName("geometry"));

        assertEquals(1, session.queries.size());
        assertEquals("select 'geometry'::text::regtype::oid", session.queries.get(0));
    }

    @Test
    public void testRegisterQualifiedName() throws IOException {
        session.result = 20001;

        PgType type = GeometryTypes.register(session, "postgis.geometry");

        assertEquals("select 'postgis.geometry'::text::regtype::oid", session.queries.get(0));
        assertEquals("geometry", type.getName());
        assertEquals(20001, type.getOid());
    }

    @Test
    public void testRegisterRejectsBadTypeName() throws IOException {
        try {
            GeometryTypes.register(session, "geometry'; drop table users; --");
            fail("not an identifier");
        } catch (IllegalArgumentException e) {
        }

        assertTrue(session.queries.isEmpty());
        assertNull(session.typeMap.getTypeForName("geometry"));
    }

    @Test
    public void testRegisterQueryFails() {
        Map<String, String> errorData = new HashMap<>();
        errorData.put("S", "ERROR");
        errorData.put("C", "42704");
        errorData.put("M", "type \"geometry\" does not exist");
        session.failure = new CommandException("Failed to execute query", errorData);

        try {
            GeometryTypes.register(session);
            fail("postgis not installed");
        } catch (CommandException e) {
            assertEquals("get geometry oid failed", e.getMessage());
            assertSame(session.failure, e.getCause());
            assertEquals("42704", ((CommandException) e.getCause()).getSqlState());
        } catch (IOException e) {
            fail("expected CommandException, got " + e);
        }

        assertNull(session.typeMap.getTypeForName("geometry"));
    }

    @Test
    public void testRegisterNoOid() throws IOException {
        session.result = null;

        try {
            GeometryTypes.register(session);
            fail("no oid");
        } catch (CommandException e) {
            assertTrue(e.getMessage().startsWith("get geometry oid failed"));
        }

        assertNull(session.typeMap.getTypeForName("geometry"));
    }

    @Test
    public void testRegisteredTypeRoundtrip() throws IOException {
        session.result = 16393L;
        GeometryTypes.register(session);

        TypeMap types = session.getTypeMap();
        assertEquals(FormatCode.BINARY, types.preferredFormat(16393));

        Point want = new GeometryFactory().createPoint(new Coordinate(1, 2));

        for (short format : new short[]{FormatCode.BINARY, FormatCode.TEXT}) {
            WireBuffer buf = new WireBuffer();
            assertTrue(types.encode(16393, format, want, buf));

            Ref<Point> got = Ref.to(Point.class);
            types.scan(16393, format, buf.toByteArray(), got);

            assertEquals(want, got.get());
            assertEquals(want, types.decodeValue(16393, format, buf.toByteArray()));
        }
    }

    @Test
    public void testRegisterLargeOid() throws IOException {
        // above 2^31 - 1, kept as the same 32 bits
        session.result = 3000000000L;

        PgType type = GeometryTypes.register(session);

        assertEquals((int) 3000000000L, type.getOid());
        assertSame(type, session.typeMap.getTypeForOid((int) 3000000000L));
    }

    @Test
    public void testRegisterOidOutOfRange() throws IOException {
        for (long bad : new long[]{-1L, 0x100000000L}) {
            session.result = bad;

            try {
                GeometryTypes.register(session);
                fail(bad + " is not an oid");
            } catch (CommandException e) {
                assertTrue(e.getMessage().startsWith("get geometry oid failed"));
            }
        }

        assertNull(session.typeMap.getTypeForName("geometry"));
    }
}
