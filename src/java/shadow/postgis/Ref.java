package shadow.postgis;

/**
 * A typed slot a ScanPlan writes its result into.
 * <p/>
 * The declared type is kept at runtime so plans can check what the caller expects
 * before writing. Not thread-safe, one Ref per column per row.
 */
public final class Ref<T> {
    private final Class<T> type;
    private T value;

    private Ref(Class<T> type, T value) {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        this.type = type;
        this.value = value;
    }

    public static <T> Ref<T> to(Class<T> type) {
        return new Ref<>(type, null);
    }

    public static <T> Ref<T> to(Class<T> type, T initial) {
        return new Ref<>(type, initial);
    }

    public Class<T> getType() {
        return type;
    }

    public T get() {
        return value;
    }

    /**
     * @throws ClassCastException if value is not an instance of the declared type
     */
    public void set(Object value) {
        this.value = type.cast(value);
    }

    @Override
    public String toString() {
        return "Ref{" +
                "type=" + type.getName() +
                ", value=" + value +
                '}';
    }
}
