package io.datafold.sdk.inspect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-parameter sanity checks plus informational insights such as timestamp age.
 *
 * @param parameters checks keyed by wire parameter name ({@code created}, {@code keyid}, {@code alg}, {@code nonce})
 */
public record ParameterValidation(boolean allValid, Map<String, ParameterCheck> parameters, List<String> insights) {

    public ParameterValidation {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        insights = List.copyOf(insights);
    }

    /**
     * @param message why the parameter is invalid, or {@code null} when valid
     */
    public record ParameterCheck(boolean valid, String message) {

        static ParameterCheck ok() {
            return new ParameterCheck(true, null);
        }

        static ParameterCheck invalid(String message) {
            return new ParameterCheck(false, message);
        }
    }
}
