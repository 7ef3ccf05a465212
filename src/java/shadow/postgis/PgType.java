package shadow.postgis;

/**
 * registry entry, a named postgres type with its session OID and the codec handling it
 */
public final class PgType {
    private final String name;
    private final Codec codec;
    private final int oid;

    public PgType(String name, Codec codec, int oid) {
        if (name == null || codec == null) {
            throw new IllegalArgumentException("name and codec are required");
        }
        this.name = name;
        this.codec = codec;
        this.oid = oid;
    }

    public String getName() {
        return name;
    }

    public Codec getCodec() {
        return codec;
    }

    public int getOid() {
        return oid;
    }

    @Override
    public String toString() {
        return "PgType{" +
                "name='" + name + '\'' +
                ", oid=" + oid +
                ", codec=" + codec.getClass().getName() +
                '}';
    }
}
