package shadow.postgis.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shadow.postgis.CommandException;
import shadow.postgis.PgType;
import shadow.postgis.Session;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Registers the postgis geometry type on a connection.
 * <p/>
 * geometry comes from an extension so its OID differs between databases, it must be looked up
 * once per connection (ie. for every new pooled connection) before any query binds or returns
 * geometry values.
 */
public class GeometryTypes {
    private static final Logger LOG = LoggerFactory.getLogger(GeometryTypes.class);

    public static final String TYPE_NAME = "geometry";

    // plain or schema qualified identifier, it ends up inside a string literal
    private static final Pattern TYPE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

    private GeometryTypes() {
    }

    public static String oidQuery(String typeName) {
        if (typeName == null || !TYPE_NAME_PATTERN.matcher(typeName).matches()) {
            throw new IllegalArgumentException(String.format("invalid type name: %s", typeName));
        }
        return String.format("select '%s'::text::regtype::oid", typeName);
    }

    public static PgType register(Session session) throws IOException {
        return register(session, TYPE_NAME);
    }

    /**
     * @param typeName name to resolve, schema qualified if postgis is not on the search_path (eg. postgis.geometry)
     * @return the registered type
     * @throws CommandException if the OID could not be resolved, nothing is registered then
     */
    public static PgType register(Session session, String typeName) throws IOException {
        final String sql = oidQuery(typeName);

        final Object result;
        try {
            result = session.queryScalar(sql);
        } catch (IOException e) {
            throw new CommandException("get geometry oid failed", e);
        }

        if (!(result instanceof Number)) {
            throw new CommandException(String.format("get geometry oid failed\nsql: %s\nresult: %s", sql, result));
        }

        // oid is unsigned 32bit, drivers may hand it out as Long. OIDs are kept as int like
        // the wire protocol does, so values above 2^31 - 1 are stored as their negative bit pattern.
        final long unsignedOid = ((Number) result).longValue();
        if (unsignedOid < 0 || unsignedOid > 0xFFFFFFFFL) {
            throw new CommandException(String.format("get geometry oid failed\nsql: %s\nresult: %d is not an oid", sql, unsignedOid));
        }
        final int oid = (int) unsignedOid;

        final PgType type = new PgType(TYPE_NAME, new GeometryCodec(), oid);
        session.getTypeMap().registerType(type);

        LOG.debug("{} resolved to oid {}", typeName, oid);
        return type;
    }
}
