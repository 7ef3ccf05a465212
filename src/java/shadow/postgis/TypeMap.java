package shadow.postgis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Connection scoped Type Registry
 * <p/>
 * Maps the OIDs the server assigned in this session to the codec handling them. Types from
 * extensions (postgis geometry, hstore, ...) have no constant OID so each connection must
 * register them after connecting and before the first query using them.
 * <p/>
 * Lookups and dispatch are safe once registration is done, registration itself is
 * NOT THREAD-SAFE, same as the connection it belongs to.
 */
public class TypeMap {
    private static final Logger LOG = LoggerFactory.getLogger(TypeMap.class);

    private final Map<Integer, PgType> typesByOid = new HashMap<>();
    private final Map<String, PgType> typesByName = new HashMap<>();

    private MetricCollector metricCollector = MetricCollector.VOID;

    public TypeMap() {
    }

    /**
     * replaces any type previously registered under the same oid or name
     */
    public TypeMap registerType(PgType type) {
        final PgType sameName = typesByName.remove(type.getName());
        if (sameName != null) {
            typesByOid.remove(sameName.getOid());
        }

        final PgType sameOid = typesByOid.remove(type.getOid());
        if (sameOid != null) {
            typesByName.remove(sameOid.getName());
        }

        typesByOid.put(type.getOid(), type);
        typesByName.put(type.getName(), type);

        LOG.debug("registered type {} with oid {}", type.getName(), type.getOid());
        return this;
    }

    public PgType getTypeForOid(int oid) {
        return typesByOid.get(oid);
    }

    public PgType getTypeForName(String name) {
        return typesByName.get(name);
    }

    public MetricCollector getMetricCollector() {
        return metricCollector;
    }

    public TypeMap setMetricCollector(MetricCollector metricCollector) {
        this.metricCollector = metricCollector == null ? MetricCollector.VOID : metricCollector;
        return this;
    }

    private PgType requireType(int oid) {
        final PgType type = typesByOid.get(oid);
        if (type == null) {
            throw new IllegalArgumentException(String.format("unsupported type: %d", oid));
        }
        return type;
    }

    public short preferredFormat(int oid) {
        return requireType(oid).getCodec().preferredFormat();
    }

    public EncodePlan planEncode(int oid, short format, Object value) {
        return requireType(oid).getCodec().planEncode(this, oid, format, value);
    }

    public ScanPlan planScan(int oid, short format, Object target) {
        return requireType(oid).getCodec().planScan(this, oid, format, target);
    }

    /**
     * encode a parameter value
     *
     * @return false if value was null (SQL NULL), nothing is written then
     */
    public boolean encode(int oid, short format, Object value, WireBuffer out) throws IOException {
        if (value == null) {
            return false;
        }

        final PgType type = requireType(oid);
        final EncodePlan plan = type.getCodec().planEncode(this, oid, format, value);
        if (plan == null) {
            throw new IllegalArgumentException(
                    String.format("type %s can't encode %s in %s format",
                            type.getName(),
                            value.getClass().getName(),
                            FormatCode.nameOf(format)));
        }

        final long start = System.nanoTime();
        plan.encode(value, out);
        metricCollector.collectEncodeTime(type.getName(), format, System.nanoTime() - start);
        return true;
    }

    /**
     * decode a column value into target, src null or empty is SQL NULL
     */
    public void scan(int oid, short format, byte[] src, Object target) throws IOException {
        final PgType type = requireType(oid);
        final ScanPlan plan = type.getCodec().planScan(this, oid, format, target);
        if (plan == null) {
            throw new IllegalArgumentException(
                    String.format("type %s can't scan %s format",
                            type.getName(),
                            FormatCode.nameOf(format)));
        }

        final long start = System.nanoTime();
        plan.scan(src, target);
        metricCollector.collectDecodeTime(type.getName(), format, System.nanoTime() - start);
    }

    /**
     * decode a column value without a target
     *
     * @return decoded value, null for SQL NULL
     */
    public Object decodeValue(int oid, short format, byte[] src) throws IOException {
        if (src == null) {
            return null;
        }

        final PgType type = requireType(oid);

        final long start = System.nanoTime();
        Object value = type.getCodec().decodeValue(this, oid, format, src);
        metricCollector.collectDecodeTime(type.getName(), format, System.nanoTime() - start);
        return value;
    }
}
