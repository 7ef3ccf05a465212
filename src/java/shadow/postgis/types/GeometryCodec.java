package shadow.postgis.types;

import org.locationtech.jts.geom.Geometry;
import shadow.postgis.Codec;
import shadow.postgis.EncodePlan;
import shadow.postgis.FormatCode;
import shadow.postgis.Ref;
import shadow.postgis.ScanPlan;
import shadow.postgis.TypeMap;
import shadow.postgis.WireBuffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * postgis geometry as JTS Geometry
 * <p/>
 * binary format is EWKB, text format is the same EWKB hex encoded. Both directions ignore
 * the column, the OID is only used to route values here.
 * <p/>
 * Scanning requires a {@link Ref} declaring which Geometry subclass is expected. A Ref
 * declared as Geometry accepts any geometry, a Ref declared as Point only accepts a Point.
 * There is no conversion between geometry types.
 */
public class GeometryCodec implements Codec {

    private static final HexFormat HEX = HexFormat.of();

    static final EncodePlan BINARY_ENCODE = new BinaryEncodePlan();
    static final EncodePlan TEXT_ENCODE = new TextEncodePlan();
    static final ScanPlan BINARY_SCAN = new BinaryScanPlan();
    static final ScanPlan TEXT_SCAN = new TextScanPlan();

    @Override
    public boolean formatSupported(short format) {
        switch (format) {
            case FormatCode.BINARY:
            case FormatCode.TEXT:
                return true;
            default:
                return false;
        }
    }

    @Override
    public short preferredFormat() {
        return FormatCode.BINARY;
    }

    @Override
    public EncodePlan planEncode(TypeMap map, int oid, short format, Object value) {
        switch (format) {
            case FormatCode.BINARY:
                return BINARY_ENCODE;
            case FormatCode.TEXT:
                return TEXT_ENCODE;
            default:
                return null;
        }
    }

    @Override
    public ScanPlan planScan(TypeMap map, int oid, short format, Object target) {
        switch (format) {
            case FormatCode.BINARY:
                return BINARY_SCAN;
            case FormatCode.TEXT:
                return TEXT_SCAN;
            default:
                return null;
        }
    }

    /**
     * returns whatever geometry the bytes contain, unlike scan there is nothing to check it against
     */
    @Override
    public Object decodeValue(TypeMap map, int oid, short format, byte[] src) throws IOException {
        switch (format) {
            case FormatCode.TEXT:
                if (src == null || src.length == 0) {
                    return null;
                }
                return Ewkb.unmarshal(hexDecode(src));
            case FormatCode.BINARY:
                if (src == null || src.length == 0) {
                    return null;
                }
                return Ewkb.unmarshal(src);
            default:
                throw new UnsupportedOperationException(String.format("geometry can't decode format %d", format));
        }
    }

    @Override
    public Object decodeDriverValue(TypeMap map, int oid, short format, byte[] src) throws IOException {
        throw new UnsupportedOperationException("geometry has no driver value, scan into a Ref<Geometry> instead");
    }

    static byte[] hexDecode(byte[] src) {
        // IllegalArgumentException for odd length or non-hex chars, callers let it through
        return HEX.parseHex(new String(src, StandardCharsets.US_ASCII));
    }

    static byte[] hexEncode(byte[] ewkb) {
        return HEX.formatHex(ewkb).getBytes(StandardCharsets.US_ASCII);
    }

    abstract static class GeometryEncodePlan implements EncodePlan {

        abstract byte[] wrap(byte[] ewkb);

        @Override
        public void encode(Object value, WireBuffer out) throws IOException {
            if (!(value instanceof Geometry)) {
                throw new UnsupportedOperationException(
                        String.format("not a geometry: %s", value == null ? "null" : value.getClass().getName()));
            }

            final byte[] ewkb;
            try {
                ewkb = Ewkb.marshal((Geometry) value, Ewkb.DEFAULT_SRID, Ewkb.DEFAULT_BYTE_ORDER);
            } catch (EwkbException e) {
                throw new EwkbException("failed to encode geometry", e);
            }

            // only write once everything is encoded
            out.write(wrap(ewkb));
        }
    }

    static final class BinaryEncodePlan extends GeometryEncodePlan {
        @Override
        byte[] wrap(byte[] ewkb) {
            return ewkb;
        }
    }

    static final class TextEncodePlan extends GeometryEncodePlan {
        @Override
        byte[] wrap(byte[] ewkb) {
            return hexEncode(ewkb);
        }
    }

    abstract static class GeometryScanPlan implements ScanPlan {

        abstract byte[] unwrap(byte[] src);

        @Override
        public void scan(byte[] src, Object target) throws IOException {
            if (!(target instanceof Ref)) {
                throw new IllegalArgumentException(String.format("target must be a reference to a %s", Geometry.class.getName()));
            }

            final Ref<?> ref = (Ref<?>) target;
            final Class<?> targetType = ref.getType();
            if (!Geometry.class.isAssignableFrom(targetType)) {
                throw new IllegalArgumentException(String.format("target must be a reference to a %s", Geometry.class.getName()));
            }

            // NULL
            if (src == null || src.length == 0) {
                return;
            }

            final Geometry geom = Ewkb.unmarshal(unwrap(src));
            final Class<?> geomType = geom.getClass();

            if (targetType != Geometry.class && targetType != geomType) {
                throw new IllegalArgumentException(
                        String.format("target type %s doesn't match geometry type %s", targetType.getName(), geomType.getName()));
            }

            ref.set(geom);
        }
    }

    static final class BinaryScanPlan extends GeometryScanPlan {
        @Override
        byte[] unwrap(byte[] src) {
            return src;
        }
    }

    static final class TextScanPlan extends GeometryScanPlan {
        @Override
        byte[] unwrap(byte[] src) {
            return hexDecode(src);
        }
    }
}
