package io.datafold.sdk.signing;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * The exact byte sequence that is signed or verified.
 *
 * @param lines              every {@code "<component>": <value>} line, {@code @signature-params} last
 * @param coveredComponents  component names in emission order, excluding {@code @signature-params}
 * @param signatureParams    the serialised parameter list, reused for {@code Signature-Input}
 */
public record CanonicalMessage(List<String> lines, List<String> coveredComponents, String signatureParams) {

    public CanonicalMessage {
        lines = List.copyOf(lines);
        coveredComponents = List.copyOf(coveredComponents);
    }

    public String text() {
        return String.join("\n", lines);
    }

    public byte[] bytes() {
        return text().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return text();
    }
}
