package io.datafold.sdk.verification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wall-clock timings of a verification run in milliseconds. Step timings keep their recording order.
 */
public record PerformanceMetrics(double totalMillis, Map<String, Double> stepTimings) {

    public PerformanceMetrics {
        stepTimings = stepTimings == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stepTimings));
    }
}
