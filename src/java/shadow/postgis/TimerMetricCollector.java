package shadow.postgis;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Records codec timings as Timers in a MetricRegistry
 * <p/>
 * names are shadow-postgis.type.[name].[format].(encode|decode)
 */
public class TimerMetricCollector implements MetricCollector {
    public static final String PREFIX = "shadow-postgis";

    private final MetricRegistry metricRegistry;

    public TimerMetricCollector(MetricRegistry metricRegistry) {
        this.metricRegistry = metricRegistry;
    }

    public MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }

    public static String timerName(String typeName, short format, String direction) {
        return MetricRegistry.name(PREFIX, "type", typeName, FormatCode.nameOf(format), direction);
    }

    @Override
    public void collectEncodeTime(String typeName, short format, long nanos) {
        timer(typeName, format, "encode").update(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void collectDecodeTime(String typeName, short format, long nanos) {
        timer(typeName, format, "decode").update(nanos, TimeUnit.NANOSECONDS);
    }

    private Timer timer(String typeName, short format, String direction) {
        // registry.timer is get-or-create and thread-safe
        return metricRegistry.timer(timerName(typeName, format, direction));
    }
}
