package shadow.postgis.types;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ByteOrderValues;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;

/**
 * Extended Well-Known Binary as postgis uses it on the wire.
 * <p/>
 * EWKB is WKB with an optional SRID behind the type word (flag 0x20000000). JTS reads it and
 * writes it when asked to include the SRID. Readers and writers keep buffers, so each call
 * gets its own.
 */
public final class Ewkb {
    /**
     * keep whatever SRID the geometry carries, 0 writes plain WKB without the SRID flag
     * <p/>
     * geometries are not stamped with 4326 or any other SRID. postgis reads a geometry without
     * SRID as SRID 0, so values bound for a geometry(..., 4326) column need setSRID(4326) first.
     */
    public static final int DEFAULT_SRID = 0;

    /**
     * NDR, what postgis itself produces
     */
    public static final int DEFAULT_BYTE_ORDER = ByteOrderValues.LITTLE_ENDIAN;

    private Ewkb() {
    }

    /**
     * @param geom
     * @param srid DEFAULT_SRID or an SRID that overrides the one on geom
     * @param byteOrder ByteOrderValues.BIG_ENDIAN or LITTLE_ENDIAN
     */
    public static byte[] marshal(Geometry geom, int srid, int byteOrder) throws EwkbException {
        if (geom == null) {
            throw new EwkbException("no geometry to marshal");
        }
        if (byteOrder != ByteOrderValues.BIG_ENDIAN && byteOrder != ByteOrderValues.LITTLE_ENDIAN) {
            throw new EwkbException(String.format("unknown byte order: %d", byteOrder));
        }

        Geometry out = geom;
        if (srid != DEFAULT_SRID && srid != geom.getSRID()) {
            out = geom.copy();
            out.setSRID(srid);
        }

        try {
            return new WKBWriter(outputDimension(out), byteOrder, out.getSRID() != 0).write(out);
        } catch (RuntimeException e) {
            throw new EwkbException(String.format("can't write %s as EWKB", geom.getGeometryType()), e);
        }
    }

    /**
     * 3 if the geometry carries Z values, 2 otherwise
     * <p/>
     * a fixed 3 would write NaN Z ordinates for 2d input. M ordinates are not written.
     */
    static int outputDimension(Geometry geom) {
        final Coordinate first = geom.getCoordinate();
        if (first != null && !Double.isNaN(first.getZ())) {
            return 3;
        }
        return 2;
    }

    public static Geometry unmarshal(byte[] src) throws EwkbException {
        try {
            return new WKBReader().read(src);
        } catch (ParseException e) {
            throw new EwkbException(String.format("invalid EWKB: %s", e.getMessage()), e);
        } catch (RuntimeException e) {
            // truncated input surfaces as index errors in some JTS versions
            throw new EwkbException(String.format("invalid EWKB (%d bytes)", src.length), e);
        }
    }
}
