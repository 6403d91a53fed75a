package io.datafold.sdk.inspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datafold.sdk.internal.Json;
import io.datafold.sdk.signing.SignatureAlgorithm;
import io.datafold.sdk.signing.SignatureComponents;
import io.datafold.sdk.signing.SignatureParams;
import io.datafold.sdk.signing.SignatureParamsGenerator;
import io.datafold.sdk.verification.ComponentSecurity;
import io.datafold.sdk.verification.ExtractedSignatureData;
import io.datafold.sdk.verification.ResultError;
import io.datafold.sdk.verification.SignatureExtractor;
import io.datafold.sdk.verification.VerificationDiagnostics;
import io.datafold.sdk.verification.VerificationException;
import io.datafold.sdk.verification.VerificationResult;
import io.datafold.sdk.verification.VerificationRuleResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only debugging helpers for signature headers and verification results: format linting, component scoring,
 * parameter sanity checks and human readable reports.
 */
public final class SignatureInspector {

    static final List<String> SUPPORTED_PSEUDO_COMPONENTS =
        List.of(SignatureComponents.METHOD, SignatureComponents.TARGET_URI);
    static final List<String> UNSUPPORTED_PSEUDO_COMPONENTS =
        List.of("@authority", "@scheme", "@request-target", "@path", "@query", "@query-param", "@status");
    static final List<String> RECOMMENDED_COMPONENTS =
        List.of(SignatureComponents.METHOD, SignatureComponents.TARGET_URI);

    private static final Pattern HEADER_NAME = Pattern.compile("^[!#$%&'*+\\-.0-9A-Z^_`a-z|~]+$");
    private static final Pattern SIGNATURE_FORMAT = Pattern.compile("^[^=]+=:[0-9a-f]+:$");
    private static final Pattern SIGNATURE_HEX = Pattern.compile(":([0-9a-fA-F]+):");
    private static final Pattern CONTENT_DIGEST_FORMAT = Pattern.compile("^[^=]+=:[A-Za-z0-9+/]+=*:$");
    private static final Pattern COMPONENT_LIST = Pattern.compile("\\(([^)]+)\\)");
    private static final DateTimeFormatter CREATED_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT).withZone(ZoneOffset.UTC);
    private static final long OLD_TIMESTAMP_SECONDS = 3600L;
    private static final int ED25519_SIGNATURE_HEX_LENGTH = 128;

    private final Clock clock;

    public SignatureInspector() {
        this(Clock.systemUTC());
    }

    public SignatureInspector(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Lints raw signature headers without verifying anything.
     */
    public FormatAnalysis inspectFormat(Map<String, String> headers) {
        List<FormatIssue> issues = new ArrayList<>();
        List<String> signatureIds = new ArrayList<>();
        Map<String, String> found = findSignatureHeaders(headers);

        if (!found.containsKey(SignatureExtractor.SIGNATURE_INPUT)) {
            issues.add(new FormatIssue(Severity.ERROR, "MISSING_SIGNATURE_INPUT",
                "Signature-Input header is required", SignatureExtractor.SIGNATURE_INPUT));
        }
        if (!found.containsKey(SignatureExtractor.SIGNATURE)) {
            issues.add(new FormatIssue(Severity.ERROR, "MISSING_SIGNATURE",
                "Signature header is required", SignatureExtractor.SIGNATURE));
        }

        String signatureInput = found.get(SignatureExtractor.SIGNATURE_INPUT);
        if (signatureInput != null) {
            try {
                SignatureExtractor.ParsedSignatureInput parsed = SignatureExtractor.parseSignatureInput(signatureInput);
                signatureIds.add(parsed.label());
                lintSignatureInput(signatureInput, issues);
                lintParameters(parsed.parameters(), issues);
                lintComponents(parsed.coveredComponents(), issues);
            } catch (VerificationException ex) {
                issues.add(new FormatIssue(Severity.ERROR, "INVALID_SIGNATURE_INPUT_FORMAT",
                    "Failed to parse signature-input: " + ex.getMessage(), SignatureExtractor.SIGNATURE_INPUT));
            }
        }

        String signature = found.get(SignatureExtractor.SIGNATURE);
        if (signature != null) {
            lintSignature(signature, issues);
        }
        String contentDigest = found.get(SignatureExtractor.CONTENT_DIGEST);
        if (contentDigest != null) {
            lintContentDigest(contentDigest, issues);
        }

        boolean compliant = issues.stream().noneMatch(issue -> issue.severity() == Severity.ERROR);
        return new FormatAnalysis(compliant, issues, new ArrayList<>(found.keySet()), signatureIds);
    }

    public boolean isCompliant(Map<String, String> headers) {
        return inspectFormat(headers).rfc9421Compliant();
    }

    public ComponentAnalysis analyzeComponents(ExtractedSignatureData signature) {
        Objects.requireNonNull(signature, "signature");
        List<String> valid = new ArrayList<>();
        List<ComponentIssue> invalid = new ArrayList<>();
        for (String component : signature.coveredComponents()) {
            Optional<String> problem = componentProblem(component);
            if (problem.isPresent()) {
                invalid.add(new ComponentIssue(component, "format", problem.get()));
            } else {
                valid.add(component);
            }
        }
        List<String> missing = new ArrayList<>();
        for (String recommended : RECOMMENDED_COMPONENTS) {
            if (!signature.coveredComponents().contains(recommended)) {
                missing.add(recommended);
            }
        }
        return new ComponentAnalysis(valid, invalid, missing, ComponentSecurity.assess(signature.coveredComponents()));
    }

    public ParameterValidation validateParameters(SignatureParams params) {
        Objects.requireNonNull(params, "params");
        Map<String, ParameterValidation.ParameterCheck> checks = new LinkedHashMap<>();
        List<String> insights = new ArrayList<>();

        if (!SignatureParamsGenerator.isValidTimestamp(params.created())) {
            checks.put("created", ParameterValidation.ParameterCheck.invalid("Invalid timestamp format or value"));
        } else {
            checks.put("created", ParameterValidation.ParameterCheck.ok());
            long age = clock.instant().getEpochSecond() - params.created();
            if (age > OLD_TIMESTAMP_SECONDS) {
                insights.add("Timestamp is " + (age / 60) + " minutes old");
            }
            if (age < 0) {
                insights.add("Timestamp is from the future (possible clock skew)");
            }
        }

        checks.put("keyid", params.keyId().isBlank()
            ? ParameterValidation.ParameterCheck.invalid("Key ID must be a non-empty string")
            : ParameterValidation.ParameterCheck.ok());
        checks.put("alg", SignatureAlgorithm.fromWireName(params.algorithm()).isPresent()
            ? ParameterValidation.ParameterCheck.ok()
            : ParameterValidation.ParameterCheck.invalid("Unsupported algorithm: " + params.algorithm()));
        checks.put("nonce", SignatureParamsGenerator.isValidNonce(params.nonce())
            ? ParameterValidation.ParameterCheck.ok()
            : ParameterValidation.ParameterCheck.invalid("Invalid nonce format (should be UUID v4)"));

        boolean allValid = checks.values().stream().allMatch(ParameterValidation.ParameterCheck::valid);
        return new ParameterValidation(allValid, checks, insights);
    }

    public SecurityReport analyzeSecurity(ExtractedSignatureData signature) {
        ComponentAnalysis components = analyzeComponents(signature);
        ParameterValidation parameters = validateParameters(signature.params());
        return new SecurityReport(
            components.security(),
            parameters.allValid(),
            parameters.insights(),
            components.validComponents(),
            components.invalidComponents(),
            components.missingRecommended()
        );
    }

    /**
     * Short lint summary of raw signature headers.
     */
    public String quickDiagnostic(Map<String, String> headers) {
        FormatAnalysis analysis = inspectFormat(headers);
        List<String> lines = new ArrayList<>();
        lines.add("=== Quick Signature Diagnostic ===");
        lines.add("RFC 9421 Compliant: " + yesNo(analysis.rfc9421Compliant()));
        lines.add("Signature Headers Found: " + String.join(", ", analysis.signatureHeaders()));
        lines.add("Signature IDs: " + String.join(", ", analysis.signatureIds()));
        if (!analysis.issues().isEmpty()) {
            lines.add("");
            lines.add("Issues Found:");
            for (FormatIssue issue : analysis.issues()) {
                lines.add("  " + icon(issue.severity()) + " " + issue.message());
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Multi-section plain text report of a verification result.
     */
    public String generateDiagnosticReport(VerificationResult result) {
        Objects.requireNonNull(result, "result");
        List<String> lines = new ArrayList<>();
        lines.add("=== RFC 9421 Signature Verification Report ===");
        lines.add("");
        lines.add("Overall Status: " + result.status().wireName().toUpperCase(Locale.ROOT));
        lines.add("Signature Valid: " + yesNo(result.signatureValid()));
        lines.add("");

        lines.add("=== Individual Checks ===");
        result.checks().forEach((check, passed) -> lines.add(mark(passed) + " " + check.label()));
        lines.add("");

        VerificationDiagnostics diagnostics = result.diagnostics();
        VerificationDiagnostics.SignatureAnalysis signature = diagnostics.signature();
        lines.add("=== Signature Analysis ===");
        lines.add("Algorithm: " + orNa(signature.algorithm()));
        lines.add("Key ID: " + orNa(signature.keyId()));
        if (signature.created() > 0) {
            lines.add("Created: " + CREATED_FORMAT.format(Instant.ofEpochSecond(signature.created())));
            lines.add("Age: " + signature.ageSeconds() + " seconds");
        }
        lines.add("Nonce: " + orNa(signature.nonce()));
        lines.add("Covered Components: " + (signature.coveredComponents().isEmpty()
            ? "None"
            : String.join(", ", signature.coveredComponents())));
        lines.add("");

        VerificationDiagnostics.ContentAnalysis content = diagnostics.content();
        lines.add("=== Content Analysis ===");
        lines.add("Has Content Digest: " + yesNo(content.hasContentDigest()));
        if (content.digestAlgorithm() != null) {
            lines.add("Digest Algorithm: " + content.digestAlgorithm());
        }
        lines.add("Content Size: " + content.contentSize() + " bytes");
        if (content.contentType() != null) {
            lines.add("Content Type: " + content.contentType());
        }
        lines.add("");

        VerificationDiagnostics.PolicyCompliance policy = diagnostics.policy();
        lines.add("=== Policy Compliance ===");
        lines.add("Policy: " + orNa(policy.policyName()));
        if (!policy.missingRequiredComponents().isEmpty()) {
            lines.add("Missing Required Components: " + String.join(", ", policy.missingRequiredComponents()));
        }
        if (!policy.extraComponents().isEmpty()) {
            lines.add("Extra Components: " + String.join(", ", policy.extraComponents()));
        }
        if (!policy.customRuleResults().isEmpty()) {
            lines.add("");
            lines.add("=== Custom Rule Results ===");
            for (VerificationRuleResult rule : policy.customRuleResults()) {
                lines.add(mark(rule.passed()) + " " + (rule.message().isEmpty() ? "Rule validation" : rule.message()));
            }
        }

        VerificationDiagnostics.SecurityAnalysis security = diagnostics.security();
        lines.add("");
        lines.add("=== Security Analysis ===");
        lines.add("Security Level: " + security.level().wireName().toUpperCase(Locale.ROOT));
        if (!security.concerns().isEmpty()) {
            lines.add("");
            lines.add("Security Concerns:");
            security.concerns().forEach(concern -> lines.add("  - " + concern));
        }
        if (!security.recommendations().isEmpty()) {
            lines.add("");
            lines.add("Recommendations:");
            security.recommendations().forEach(recommendation -> lines.add("  - " + recommendation));
        }

        lines.add("");
        lines.add("=== Performance ===");
        lines.add(String.format(Locale.ROOT, "Total Time: %.2fms", result.performance().totalMillis()));
        if (!result.performance().stepTimings().isEmpty()) {
            lines.add("Step Timings:");
            result.performance().stepTimings().forEach((step, millis) ->
                lines.add(String.format(Locale.ROOT, "  - %s: %.2fms", step, millis)));
        }

        if (result.error() != null) {
            ResultError error = result.error();
            lines.add("");
            lines.add("=== Error Details ===");
            lines.add("Code: " + error.code());
            lines.add("Message: " + error.message());
            if (!error.details().isEmpty()) {
                lines.add("Details:");
                error.details().forEach((key, value) -> lines.add("  - " + key + ": " + value));
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Structured export of a verification result with snake_case keys.
     */
    public ObjectNode toJsonNode(VerificationResult result) {
        Objects.requireNonNull(result, "result");
        ObjectMapper mapper = Json.mapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("status", result.status().wireName());
        root.put("signature_valid", result.signatureValid());
        ObjectNode checks = root.putObject("checks");
        result.checksByName().forEach(checks::put);

        VerificationDiagnostics diagnostics = result.diagnostics();
        ObjectNode diag = root.putObject("diagnostics");
        VerificationDiagnostics.SignatureAnalysis signature = diagnostics.signature();
        ObjectNode sig = diag.putObject("signature_analysis");
        sig.put("algorithm", signature.algorithm());
        sig.put("key_id", signature.keyId());
        sig.put("created", signature.created());
        sig.put("age", signature.ageSeconds());
        sig.put("nonce", signature.nonce());
        stringArray(sig.putArray("covered_components"), signature.coveredComponents());

        VerificationDiagnostics.ContentAnalysis content = diagnostics.content();
        ObjectNode contentNode = diag.putObject("content_analysis");
        contentNode.put("has_content_digest", content.hasContentDigest());
        contentNode.put("digest_algorithm", content.digestAlgorithm());
        contentNode.put("content_size", content.contentSize());
        contentNode.put("content_type", content.contentType());

        VerificationDiagnostics.PolicyCompliance policy = diagnostics.policy();
        ObjectNode policyNode = diag.putObject("policy_compliance");
        policyNode.put("policy_name", policy.policyName());
        stringArray(policyNode.putArray("missing_required_components"), policy.missingRequiredComponents());
        stringArray(policyNode.putArray("extra_components"), policy.extraComponents());
        ArrayNode rules = policyNode.putArray("rule_results");
        for (VerificationRuleResult rule : policy.customRuleResults()) {
            ObjectNode ruleNode = rules.addObject();
            ruleNode.put("rule", rule.rule());
            ruleNode.put("passed", rule.passed());
            ruleNode.put("message", rule.message());
            ruleNode.set("details", mapper.valueToTree(rule.details()));
        }

        VerificationDiagnostics.SecurityAnalysis security = diagnostics.security();
        ObjectNode securityNode = diag.putObject("security_analysis");
        securityNode.put("security_level", security.level().wireName());
        securityNode.put("score", security.score());
        stringArray(securityNode.putArray("concerns"), security.concerns());
        stringArray(securityNode.putArray("recommendations"), security.recommendations());

        ObjectNode performance = root.putObject("performance");
        performance.put("total_time", result.performance().totalMillis());
        ObjectNode steps = performance.putObject("step_timings");
        result.performance().stepTimings().forEach(steps::put);

        if (result.error() != null) {
            ObjectNode error = root.putObject("error");
            error.put("code", result.error().code());
            error.put("message", result.error().message());
            error.set("details", mapper.valueToTree(result.error().details()));
        }
        return root;
    }

    public String toJson(VerificationResult result) {
        try {
            return Json.pretty(toJsonNode(result));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("serialize verification result: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, String> findSignatureHeaders(Map<String, String> headers) {
        Map<String, String> found = new LinkedHashMap<>();
        for (String name : List.of(SignatureExtractor.SIGNATURE_INPUT, SignatureExtractor.SIGNATURE,
            SignatureExtractor.CONTENT_DIGEST)) {
            SignatureExtractor.findHeader(headers, name)
                .filter(value -> !value.isBlank())
                .ifPresent(value -> found.put(name, value.trim()));
        }
        return found;
    }

    private static void lintSignatureInput(String signatureInput, List<FormatIssue> issues) {
        if (signatureInput.indexOf('=') < 0 || signatureInput.indexOf('(') < 0 || signatureInput.indexOf(')') < 0) {
            issues.add(new FormatIssue(Severity.ERROR, "INVALID_FORMAT",
                "Signature-Input header format is invalid", SignatureExtractor.SIGNATURE_INPUT));
            return;
        }
        for (String parameter : List.of("created", "keyid", "alg")) {
            if (!signatureInput.contains(parameter + "=")) {
                issues.add(new FormatIssue(Severity.ERROR, "MISSING_PARAMETER",
                    "Missing required parameter: " + parameter, SignatureExtractor.SIGNATURE_INPUT));
            }
        }
        Matcher list = COMPONENT_LIST.matcher(signatureInput);
        if (list.find() && list.group(1).indexOf('"') < 0) {
            issues.add(new FormatIssue(Severity.WARNING, "UNQUOTED_COMPONENTS",
                "Components should be quoted according to RFC 9421", SignatureExtractor.SIGNATURE_INPUT));
        }
    }

    private static void lintParameters(Map<String, String> parameters, List<FormatIssue> issues) {
        String created = parameters.get("created");
        if (created != null && !validTimestamp(created)) {
            issues.add(new FormatIssue(Severity.ERROR, "INVALID_TIMESTAMP", "Invalid created timestamp", "created"));
        }
        if (!SignatureParamsGenerator.isValidNonce(parameters.get("nonce"))) {
            issues.add(new FormatIssue(Severity.WARNING, "INVALID_NONCE_FORMAT",
                "Nonce does not follow UUID v4 format", "nonce"));
        }
        String algorithm = parameters.get("alg");
        if (algorithm != null && SignatureAlgorithm.fromWireName(algorithm).isEmpty()) {
            issues.add(new FormatIssue(Severity.WARNING, "UNSUPPORTED_ALGORITHM",
                "Algorithm " + algorithm + " is not ed25519", "alg"));
        }
    }

    private static boolean validTimestamp(String created) {
        try {
            return SignatureParamsGenerator.isValidTimestamp(Long.parseLong(created));
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static void lintComponents(List<String> components, List<FormatIssue> issues) {
        if (components.isEmpty()) {
            issues.add(new FormatIssue(Severity.ERROR, "NO_COMPONENTS",
                "No signature components specified", "components"));
            return;
        }
        for (String component : components) {
            if (!component.equals(component.toLowerCase(Locale.ROOT))) {
                issues.add(new FormatIssue(Severity.ERROR, "NON_LOWERCASE_COMPONENT",
                    "Component names must be lowercase: " + component, "components"));
            } else if (component.startsWith("@")) {
                if (UNSUPPORTED_PSEUDO_COMPONENTS.contains(component)) {
                    issues.add(new FormatIssue(Severity.ERROR, "UNSUPPORTED_PSEUDO_COMPONENT",
                        "Pseudo-component cannot be verified: " + component, "components"));
                } else if (!SUPPORTED_PSEUDO_COMPONENTS.contains(component)) {
                    issues.add(new FormatIssue(Severity.ERROR, "UNKNOWN_PSEUDO_COMPONENT",
                        "Unknown pseudo-component: " + component, "components"));
                }
            } else if (!HEADER_NAME.matcher(component).matches()) {
                issues.add(new FormatIssue(Severity.ERROR, "INVALID_HEADER_NAME",
                    "Invalid header name: " + component, "components"));
            }
        }
    }

    private static void lintSignature(String signature, List<FormatIssue> issues) {
        if (!SIGNATURE_FORMAT.matcher(signature).matches()) {
            issues.add(new FormatIssue(Severity.ERROR, "INVALID_SIGNATURE_FORMAT",
                "Signature header format is invalid (should be name=:lowercase hex:)", SignatureExtractor.SIGNATURE));
        }
        Matcher hex = SIGNATURE_HEX.matcher(signature);
        if (hex.find() && hex.group(1).length() != ED25519_SIGNATURE_HEX_LENGTH) {
            issues.add(new FormatIssue(Severity.WARNING, "UNEXPECTED_SIGNATURE_LENGTH",
                "Signature length is " + hex.group(1).length() + " hex chars, expected 128 for Ed25519",
                SignatureExtractor.SIGNATURE));
        }
    }

    private static void lintContentDigest(String contentDigest, List<FormatIssue> issues) {
        if (!CONTENT_DIGEST_FORMAT.matcher(contentDigest).matches()) {
            issues.add(new FormatIssue(Severity.ERROR, "INVALID_CONTENT_DIGEST_FORMAT",
                "Content-Digest header format is invalid", SignatureExtractor.CONTENT_DIGEST));
        }
        if (!contentDigest.startsWith("sha-256=:") && !contentDigest.startsWith("sha-512=:")) {
            int separator = contentDigest.indexOf("=:");
            String algorithm = separator >= 0 ? contentDigest.substring(0, separator) : "unknown";
            issues.add(new FormatIssue(Severity.WARNING, "UNSUPPORTED_DIGEST_ALGORITHM",
                "Digest algorithm may not be supported: " + algorithm, SignatureExtractor.CONTENT_DIGEST));
        }
    }

    private static Optional<String> componentProblem(String component) {
        if (!component.equals(component.toLowerCase(Locale.ROOT))) {
            return Optional.of("Component names must be lowercase: " + component);
        }
        if (component.startsWith("@")) {
            if (SUPPORTED_PSEUDO_COMPONENTS.contains(component)) {
                return Optional.empty();
            }
            return Optional.of(UNSUPPORTED_PSEUDO_COMPONENTS.contains(component)
                ? "Pseudo-component cannot be verified: " + component
                : "Unknown pseudo-component: " + component);
        }
        return HEADER_NAME.matcher(component).matches()
            ? Optional.empty()
            : Optional.of("Invalid header name: " + component);
    }

    private static void stringArray(ArrayNode node, List<String> values) {
        values.forEach(node::add);
    }

    private static String yesNo(boolean value) {
        return value ? "YES" : "NO";
    }

    private static String mark(boolean passed) {
        return passed ? "✓" : "✗";
    }

    private static String icon(Severity severity) {
        switch (severity) {
            case ERROR:
                return "❌";
            case WARNING:
                return "⚠️";
            default:
                return "ℹ️";
        }
    }

    private static String orNa(String value) {
        return value == null || value.isEmpty() ? "N/A" : value;
    }
}
