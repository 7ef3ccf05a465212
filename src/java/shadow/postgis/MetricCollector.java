package shadow.postgis;

/**
 * implementations must be thread-safe as this will be called from multiple connections
 */
public interface MetricCollector {
    MetricCollector VOID = new VoidCollector();

    /**
     * time spent in an EncodePlan for one parameter value
     *
     * @param typeName registered type name, eg. geometry
     * @param format FormatCode
     * @param nanos
     */
    void collectEncodeTime(String typeName, short format, long nanos);

    /**
     * time spent decoding one column value, via ScanPlan or decodeValue
     *
     * @param typeName
     * @param format
     * @param nanos
     */
    void collectDecodeTime(String typeName, short format, long nanos);

    final class VoidCollector implements MetricCollector {
        @Override
        public void collectEncodeTime(String typeName, short format, long nanos) {
        }

        @Override
        public void collectDecodeTime(String typeName, short format, long nanos) {
        }
    }
}
