package io.datafold.sdk.verification;

import io.datafold.sdk.signing.SignatureComponents;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Scores a covered-component list by what it protects.
 */
public final class ComponentSecurity {

    public static final int MAX_SCORE = 100;

    static final List<String> SECURITY_HEADERS = List.of("authorization", "content-type", "date", "host");

    private ComponentSecurity() {
    }

    /**
     * Result of {@link #assess(List)}.
     */
    public record Assessment(SecurityLevel level, int score, List<String> strengths, List<String> weaknesses) {

        public Assessment {
            Objects.requireNonNull(level, "level");
            strengths = List.copyOf(strengths);
            weaknesses = List.copyOf(weaknesses);
        }
    }

    /**
     * Method and target URI are worth 20 points each and the content digest 30. Two or more covered headers add 20
     * (one adds 10), and each covered security header adds 5. The score is capped at {@link #MAX_SCORE}.
     */
    public static Assessment assess(List<String> covered) {
        List<String> components = covered == null ? List.of() : covered.stream()
            .filter(Objects::nonNull)
            .map(c -> c.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        int score = 0;

        if (components.contains(SignatureComponents.METHOD)) {
            score += 20;
            strengths.add("HTTP method is covered");
        } else {
            weaknesses.add("HTTP method not covered");
        }
        if (components.contains(SignatureComponents.TARGET_URI)) {
            score += 20;
            strengths.add("Target URI is covered");
        } else {
            weaknesses.add("Target URI not covered");
        }
        if (components.contains(SignatureComponents.CONTENT_DIGEST)) {
            score += 30;
            strengths.add("Content integrity protected");
        } else {
            weaknesses.add("Content integrity not protected");
        }

        List<String> headers = components.stream()
            .filter(c -> !c.startsWith("@") && !SignatureComponents.CONTENT_DIGEST.equals(c))
            .collect(Collectors.toList());
        if (headers.size() >= 2) {
            score += 20;
            strengths.add("Good header coverage (" + headers.size() + " headers)");
        } else if (headers.size() == 1) {
            score += 10;
        } else {
            weaknesses.add("Limited header coverage");
        }

        List<String> securityHeaders = headers.stream().filter(SECURITY_HEADERS::contains).collect(Collectors.toList());
        if (!securityHeaders.isEmpty()) {
            score += 5 * securityHeaders.size();
            strengths.add("Security headers covered: " + String.join(", ", securityHeaders));
        }

        score = Math.min(score, MAX_SCORE);
        return new Assessment(SecurityLevel.fromScore(score), score, strengths, weaknesses);
    }
}
