package io.datafold.sdk.signing;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Named presets for component coverage and digest strength.
 */
public enum SecurityProfile {

    STRICT(
        "strict",
        "Maximum security with comprehensive signature coverage",
        SignatureComponents.builder()
            .headers(List.of("content-type", "content-length", "user-agent", "authorization"))
            .contentDigest(true)
            .build(),
        DigestAlgorithm.SHA_512,
        false
    ),
    STANDARD(
        "standard",
        "Balanced security suitable for most applications",
        SignatureComponents.builder()
            .headers(List.of("content-type"))
            .contentDigest(true)
            .build(),
        DigestAlgorithm.SHA_256,
        true
    ),
    MINIMAL(
        "minimal",
        "Basic signing for low-latency scenarios",
        SignatureComponents.builder().build(),
        DigestAlgorithm.SHA_256,
        true
    );

    private final String profileName;
    private final String description;
    private final SignatureComponents components;
    private final DigestAlgorithm digestAlgorithm;
    private final boolean allowCustomNonces;

    SecurityProfile(String profileName, String description, SignatureComponents components,
                    DigestAlgorithm digestAlgorithm, boolean allowCustomNonces) {
        this.profileName = profileName;
        this.description = description;
        this.components = components;
        this.digestAlgorithm = digestAlgorithm;
        this.allowCustomNonces = allowCustomNonces;
    }

    public String profileName() {
        return profileName;
    }

    public String description() {
        return description;
    }

    public SignatureComponents components() {
        return components;
    }

    public DigestAlgorithm digestAlgorithm() {
        return digestAlgorithm;
    }

    /**
     * @return whether callers may pin the nonce through {@link SigningOptions}.
     */
    public boolean allowCustomNonces() {
        return allowCustomNonces;
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(SecurityProfile::profileName).toList();
    }

    public static SecurityProfile fromName(String name) throws SigningException {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (SecurityProfile profile : values()) {
                if (profile.profileName.equals(normalized)) {
                    return profile;
                }
            }
        }
        throw new SigningException(
            SigningErrorCode.UNKNOWN_PROFILE,
            "Unknown security profile: " + name,
            Map.of("availableProfiles", names())
        );
    }
}
