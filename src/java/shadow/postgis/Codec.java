package shadow.postgis;

import java.io.IOException;

/**
 * Plugin interface for a postgres type whose OID is only known once connected
 * (types from extensions like postgis).
 * <p/>
 * A Codec is registered into a {@link TypeMap} via a {@link PgType} and must be
 * thread-safe, the same instance may serve many connections.
 */
public interface Codec {

    boolean formatSupported(short format);

    /**
     * used when the caller has no format preference for a column
     */
    short preferredFormat();

    /**
     * @return plan to encode value in format, null if this codec can't encode in that format
     */
    EncodePlan planEncode(TypeMap map, int oid, short format, Object value);

    /**
     * @return plan to scan into target, null if this codec can't decode that format
     */
    ScanPlan planScan(TypeMap map, int oid, short format, Object target);

    /**
     * decode without a typed target, eg. when a row is read as a list of values
     */
    Object decodeValue(TypeMap map, int oid, short format, byte[] src) throws IOException;

    /**
     * decode into a plain driver value (String, byte[], Number)
     * <p/>
     * codecs for opaque types may refuse with UnsupportedOperationException
     */
    Object decodeDriverValue(TypeMap map, int oid, short format, byte[] src) throws IOException;
}
