package io.datafold.sdk.verification;

import io.datafold.sdk.ConfigurationException;
import io.datafold.sdk.DataFoldException;
import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.internal.Stopwatch;
import io.datafold.sdk.signing.CanonicalMessage;
import io.datafold.sdk.signing.ContentDigest;
import io.datafold.sdk.signing.ContentDigests;
import io.datafold.sdk.signing.SignatureAlgorithm;
import io.datafold.sdk.signing.SignatureComponents;
import io.datafold.sdk.signing.SignatureParams;
import io.datafold.sdk.signing.SignatureParamsGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Policy-driven RFC 9421 signature verifier.
 * <p>
 * A run extracts the signature, resolves the policy and the public key, then records format, cryptographic,
 * timestamp, nonce, content digest, component coverage and custom rule checks. Adversarial input never raises:
 * malformed headers, unknown policies and missing keys produce a {@link VerificationStatus#ERROR} result and a
 * signature that does not verify produces {@link VerificationStatus#INVALID}.
 * <p>
 * Instances are thread-safe. Only key retrieval and custom rules may complete asynchronously.
 */
public final class Verifier {

    private static final Logger LOGGER = Logger.getLogger(Verifier.class.getName());

    static final String STEP_EXTRACTION = "extraction";
    static final String STEP_POLICY_RETRIEVAL = "policy_retrieval";
    static final String STEP_KEY_RETRIEVAL = "key_retrieval";
    static final String STEP_VERIFICATION = "verification";

    private final VerificationConfig config;
    private final PublicKeyResolver keyResolver;

    public Verifier(VerificationConfig config) throws ConfigurationException {
        this.config = Objects.requireNonNull(config, "config").withDefaults();
        this.keyResolver = new PublicKeyResolver(
            this.config.getPublicKeys(),
            this.config.getKeySources(),
            this.config.getKeyRetrievalTimeout()
        );
    }

    /**
     * Verifier with the bundled policies, no registered keys and no key sources.
     */
    public static Verifier withDefaults() throws ConfigurationException {
        return new Verifier(VerificationConfig.builder().build());
    }

    public VerificationConfig config() {
        return config;
    }

    public VerificationResult verify(SignableMessage message, Map<String, String> headers) {
        return verify(VerificationRequest.of(message, headers));
    }

    public VerificationResult verify(SignableMessage message, Map<String, String> headers, String policyName) {
        return verify(VerificationRequest.builder(message).headers(headers).policy(policyName).build());
    }

    public VerificationResult verify(SignableMessage message, Map<String, String> headers, String policyName,
                                     byte[] publicKey) {
        return verify(VerificationRequest.builder(message)
            .headers(headers)
            .policy(policyName)
            .publicKey(publicKey)
            .build());
    }

    /**
     * Blocks until the run completes. Never throws for malformed input; an interrupted wait yields an error result
     * and re-asserts the thread's interrupt flag.
     */
    public VerificationResult verify(VerificationRequest request) {
        CompletableFuture<VerificationResult> future = verifyAsync(request);
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return errorResult(new VerificationException(
                VerificationErrorCode.KEY_RETRIEVAL_FAILED,
                "Verification interrupted",
                Map.of(),
                ex
            ), new PerformanceMetrics(0d, Map.of()));
        } catch (ExecutionException ex) {
            return errorResult(PublicKeyResolver.unwrap(ex), new PerformanceMetrics(0d, Map.of()));
        }
    }

    /**
     * @return a future that always completes normally with a result
     */
    public CompletableFuture<VerificationResult> verifyAsync(VerificationRequest request) {
        Objects.requireNonNull(request, "request");
        Run run = new Run(config.getClock().instant());
        try {
            ExtractedSignatureData extracted = SignatureExtractor.extract(request.headers());
            run.step(STEP_EXTRACTION);

            VerificationPolicy policy = resolvePolicy(request.policyName().orElse(config.getDefaultPolicy()));
            run.step(STEP_POLICY_RETRIEVAL);

            String keyId = request.keyIdOverride().orElse(extracted.params().keyId());
            return keyResolver.resolve(keyId, request.publicKey(), request.skipKeyRetrieval())
                .thenCompose(publicKey -> {
                    run.step(STEP_KEY_RETRIEVAL);
                    return evaluate(request, extracted, policy, publicKey, keyId, run);
                })
                .handle((result, error) -> error == null
                    ? finish(result, run)
                    : errorResult(PublicKeyResolver.unwrap(error), run.metrics()));
        } catch (VerificationException | RuntimeException ex) {
            return CompletableFuture.completedFuture(errorResult(ex, run.metrics()));
        }
    }

    /**
     * Verifies every request independently. Results keep the request order; an entry that fails unexpectedly
     * becomes a {@code BATCH_VERIFICATION_ERROR} result without affecting the others.
     */
    public List<VerificationResult> verifyBatch(List<VerificationRequest> requests) {
        CompletableFuture<List<VerificationResult>> future = verifyBatchAsync(requests);
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return requests.stream().map(request -> batchError(ex)).collect(Collectors.toList());
        } catch (ExecutionException ex) {
            Throwable cause = PublicKeyResolver.unwrap(ex);
            return requests.stream().map(request -> batchError(cause)).collect(Collectors.toList());
        }
    }

    public CompletableFuture<List<VerificationResult>> verifyBatchAsync(List<VerificationRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        List<CompletableFuture<VerificationResult>> futures = new ArrayList<>(requests.size());
        for (VerificationRequest request : requests) {
            CompletableFuture<VerificationResult> future;
            try {
                future = verifyAsync(request);
            } catch (RuntimeException ex) {
                future = CompletableFuture.failedFuture(ex);
            }
            futures.add(future.handle((result, error) -> error == null ? result : batchError(error)));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> futures.stream().map(CompletableFuture::join).collect(Collectors.toList()));
    }

    /**
     * Registers a public key for local lookup by key id.
     *
     * @throws VerificationException if the key is not 32 bytes
     */
    public void addPublicKey(String keyId, byte[] publicKey) throws VerificationException {
        if (keyId == null || keyId.isBlank()) {
            throw new VerificationException(VerificationErrorCode.INVALID_CONFIG, "Key ID is required");
        }
        if (!Ed25519.isValidKeyLength(publicKey)) {
            throw new VerificationException(
                VerificationErrorCode.INVALID_PUBLIC_KEY,
                "Public key must be " + Ed25519.KEY_LENGTH + " bytes",
                Map.of("keyId", keyId, "actualLength", publicKey == null ? 0 : publicKey.length)
            );
        }
        keyResolver.addKey(keyId, publicKey);
    }

    public boolean removePublicKey(String keyId) {
        return keyResolver.removeKey(keyId);
    }

    /**
     * Forgets every nonce recorded by the configured {@link ReplayGuard}.
     */
    public void clearReplayState() {
        config.getReplayGuard().clear();
    }

    /**
     * Caller-supplied policies shadow built-in policies of the same name.
     */
    public Optional<VerificationPolicy> policy(String name) {
        return config.getPolicies().get(name).or(() -> config.getBuiltInPolicies().get(name));
    }

    public Set<String> policyNames() {
        Set<String> names = new LinkedHashSet<>(config.getPolicies().names());
        names.addAll(config.getBuiltInPolicies().names());
        return names;
    }

    private VerificationPolicy resolvePolicy(String name) throws VerificationException {
        return policy(name).orElseThrow(() -> new VerificationException(
            VerificationErrorCode.UNKNOWN_POLICY,
            "Unknown verification policy: " + name,
            Map.of("policy", String.valueOf(name), "availablePolicies", List.copyOf(policyNames()))
        ));
    }

    private CompletableFuture<VerificationResult> evaluate(VerificationRequest request, ExtractedSignatureData extracted,
                                                           VerificationPolicy policy, byte[] publicKey, String keyId,
                                                           Run run) {
        Stopwatch verification = Stopwatch.start();
        SignableMessage message = request.message();
        Map<VerificationCheck, Boolean> checks = new EnumMap<>(VerificationCheck.class);
        List<String> missing = new ArrayList<>();
        List<String> extra = new ArrayList<>();

        run.check(checks, VerificationCheck.FORMAT, () -> checkFormat(extracted, policy));
        run.check(checks, VerificationCheck.CRYPTOGRAPHIC, () -> checkCryptographic(message, extracted, publicKey));
        run.check(checks, VerificationCheck.TIMESTAMP,
            () -> !policy.verifyTimestamp() || checkTimestamp(extracted.params(), policy, run.verifiedAt));
        run.check(checks, VerificationCheck.NONCE,
            () -> !policy.verifyNonce() || SignatureParamsGenerator.isValidNonce(extracted.params().nonce()));
        run.check(checks, VerificationCheck.CONTENT_DIGEST,
            () -> !policy.verifyContentDigest() || checkContentDigest(message, extracted, policy));
        run.check(checks, VerificationCheck.COMPONENT_COVERAGE, () -> checkCoverage(extracted, policy, missing, extra));

        VerificationContext context = new VerificationContext(
            message,
            request.headers(),
            extracted,
            policy,
            publicKey,
            keyId,
            checks.get(VerificationCheck.CRYPTOGRAPHIC),
            run.verifiedAt
        );
        Stopwatch rules = Stopwatch.start();
        return runRules(policy.customRules(), context).thenApply(ruleResults -> {
            checks.put(VerificationCheck.CUSTOM_RULES, ruleResults.stream().allMatch(VerificationRuleResult::passed));
            run.record(VerificationCheck.CUSTOM_RULES.timingKey(), rules.elapsedMillis());
            run.record(STEP_VERIFICATION, verification.elapsedMillis());
            return buildResult(message, extracted, policy, checks, missing, extra, ruleResults, run);
        });
    }

    static boolean checkFormat(ExtractedSignatureData extracted, VerificationPolicy policy) {
        SignatureParams params = extracted.params();
        return params.keyId() != null && !params.keyId().isBlank()
            && params.nonce() != null && !params.nonce().isEmpty()
            && params.created() > 0
            && policy.allowsAlgorithm(params.algorithm())
            && !extracted.coveredComponents().isEmpty();
    }

    static boolean checkCryptographic(SignableMessage message, ExtractedSignatureData extracted, byte[] publicKey) {
        if (SignatureAlgorithm.fromWireName(extracted.params().algorithm()).isEmpty()) {
            LOGGER.fine(() -> "[datafold-sdk] unsupported signature algorithm " + extracted.params().algorithm());
            return false;
        }
        CanonicalMessage canonical;
        byte[] signature;
        try {
            canonical = SignatureExtractor.reconstruct(message, extracted);
            signature = extracted.signatureBytes();
        } catch (VerificationException | IllegalArgumentException ex) {
            LOGGER.fine(() -> "[datafold-sdk] signature not verifiable: " + ex.getMessage());
            return false;
        }
        boolean valid = Ed25519.verify(publicKey, canonical.bytes(), signature);
        if (!valid) {
            LOGGER.fine(() -> "[datafold-sdk] signature " + extracted.label() + " did not verify for key "
                + extracted.params().keyId());
        }
        return valid;
    }

    static boolean checkTimestamp(SignatureParams params, VerificationPolicy policy, Instant now) {
        long created = params.created();
        if (!SignatureParamsGenerator.isValidTimestamp(created)) {
            return false;
        }
        long age = now.getEpochSecond() - created;
        return policy.maxTimestampAge()
            .map(max -> age >= -VerificationRules.CLOCK_SKEW_SECONDS && age <= max.getSeconds())
            .orElse(true);
    }

    static boolean checkContentDigest(SignableMessage message, ExtractedSignatureData extracted,
                                      VerificationPolicy policy) {
        if (!extracted.coversContentDigest()) {
            return !policy.requiredComponents().contains(SignatureComponents.CONTENT_DIGEST);
        }
        Optional<ContentDigest> digest = extracted.digest();
        return digest.isPresent() && ContentDigests.matches(message.bodyBytes(), digest.get());
    }

    static boolean checkCoverage(ExtractedSignatureData extracted, VerificationPolicy policy,
                                 List<String> missing, List<String> extra) {
        List<String> covered = extracted.coveredComponents().stream()
            .map(c -> c.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
        List<String> required = policy.requiredComponents();
        for (String component : required) {
            if (!covered.contains(component)) {
                missing.add(component);
            }
        }
        for (String component : covered) {
            if (!required.contains(component)) {
                extra.add(component);
            }
        }
        return missing.isEmpty() && (!policy.forbidExtraComponents() || extra.isEmpty());
    }

    private CompletableFuture<List<VerificationRuleResult>> runRules(List<VerificationRule> rules,
                                                                     VerificationContext context) {
        CompletableFuture<List<VerificationRuleResult>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (VerificationRule rule : rules) {
            chain = chain.thenCompose(results -> evaluateRule(rule, context).thenApply(result -> {
                results.add(result);
                return results;
            }));
        }
        return chain;
    }

    private CompletableFuture<VerificationRuleResult> evaluateRule(VerificationRule rule, VerificationContext context) {
        CompletableFuture<VerificationRuleResult> pending;
        try {
            pending = rule.evaluate(context);
        } catch (RuntimeException ex) {
            pending = CompletableFuture.failedFuture(ex);
        }
        if (pending == null) {
            pending = CompletableFuture.failedFuture(new IllegalStateException("rule returned no result"));
        }
        CompletableFuture<VerificationRuleResult> source = pending;
        long timeoutMillis = config.getRuleTimeout().toMillis();
        return source.copy()
            .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .handle((result, error) -> {
                if (error != null) {
                    Throwable cause = PublicKeyResolver.unwrap(error);
                    String reason;
                    if (cause instanceof TimeoutException) {
                        source.cancel(true);
                        reason = "timed out after " + timeoutMillis + "ms";
                    } else {
                        reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                    }
                    LOGGER.log(Level.FINE, cause, () -> "[datafold-sdk] rule " + rule.name() + " errored: " + reason);
                    return VerificationRuleResult.fail("Rule validation error: " + reason).withRule(rule.name());
                }
                if (result == null) {
                    return VerificationRuleResult.fail("Rule validation error: rule returned no result")
                        .withRule(rule.name());
                }
                return result.rule() == null || result.rule().isBlank() ? result.withRule(rule.name()) : result;
            });
    }

    private VerificationResult buildResult(SignableMessage message, ExtractedSignatureData extracted,
                                           VerificationPolicy policy, Map<VerificationCheck, Boolean> checks,
                                           List<String> missing, List<String> extra,
                                           List<VerificationRuleResult> ruleResults, Run run) {
        boolean allPassed = checks.values().stream().allMatch(Boolean::booleanValue);
        boolean signatureValid = checks.get(VerificationCheck.FORMAT) && checks.get(VerificationCheck.CRYPTOGRAPHIC);
        SignatureParams params = extracted.params();

        VerificationDiagnostics.SignatureAnalysis signature = new VerificationDiagnostics.SignatureAnalysis(
            params.algorithm(),
            params.keyId(),
            params.created(),
            run.verifiedAt.getEpochSecond() - params.created(),
            params.nonce(),
            extracted.coveredComponents()
        );
        VerificationDiagnostics.ContentAnalysis content = new VerificationDiagnostics.ContentAnalysis(
            extracted.digest().isPresent(),
            extracted.digest().map(ContentDigest::algorithm).orElse(null),
            message.bodySize(),
            message.header("content-type").orElse(null)
        );
        VerificationDiagnostics.PolicyCompliance compliance = new VerificationDiagnostics.PolicyCompliance(
            policy.name(),
            missing,
            extra,
            ruleResults
        );
        VerificationDiagnostics diagnostics = new VerificationDiagnostics(
            signature,
            content,
            compliance,
            securityAnalysis(checks, extracted.coveredComponents())
        );

        return new VerificationResult(
            allPassed ? VerificationStatus.VALID : VerificationStatus.INVALID,
            signatureValid,
            checks,
            diagnostics,
            run.metrics(),
            null
        );
    }

    static VerificationDiagnostics.SecurityAnalysis securityAnalysis(Map<VerificationCheck, Boolean> checks,
                                                                    List<String> covered) {
        List<String> concerns = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        for (VerificationCheck check : VerificationCheck.values()) {
            if (Boolean.TRUE.equals(checks.get(check))) {
                continue;
            }
            switch (check) {
                case FORMAT:
                    concerns.add("Signature format validation failed");
                    recommendations.add("Check signature parameters and allowed algorithms");
                    break;
                case CRYPTOGRAPHIC:
                    concerns.add("Cryptographic signature verification failed");
                    recommendations.add("Verify signature generation and key management");
                    break;
                case TIMESTAMP:
                    concerns.add("Timestamp validation failed");
                    recommendations.add("Check system clocks and timestamp policies");
                    break;
                case NONCE:
                    concerns.add("Nonce validation failed");
                    recommendations.add("Ensure proper nonce generation and format");
                    break;
                case CONTENT_DIGEST:
                    concerns.add("Content digest validation failed");
                    recommendations.add("Verify content integrity and digest calculation");
                    break;
                case COMPONENT_COVERAGE:
                    concerns.add("Component coverage requirements not met");
                    recommendations.add("Review signature component coverage policy");
                    break;
                case CUSTOM_RULES:
                    concerns.add("Custom rule validation failed");
                    recommendations.add("Review custom rule results");
                    break;
                default:
                    break;
            }
        }
        ComponentSecurity.Assessment assessment = ComponentSecurity.assess(covered);
        concerns.addAll(assessment.weaknesses());
        return new VerificationDiagnostics.SecurityAnalysis(
            assessment.level(),
            assessment.score(),
            concerns,
            recommendations
        );
    }

    private VerificationResult finish(VerificationResult result, Run run) {
        double total = result.performance().totalMillis();
        long limit = config.getMaxVerificationTime().toMillis();
        if (total > limit) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[datafold-sdk] verification took %.2fms (target: <%dms)", total, limit));
        }
        LOGGER.fine(() -> "[datafold-sdk] verification of " + result.diagnostics().signature().keyId()
            + " finished " + result.status().wireName() + " in " + String.format(Locale.ROOT, "%.2fms", total));
        return result;
    }

    private static VerificationResult errorResult(Throwable error, PerformanceMetrics metrics) {
        ResultError resultError;
        if (error instanceof DataFoldException) {
            resultError = ResultError.from((DataFoldException) error);
        } else {
            resultError = new ResultError(
                VerificationErrorCode.VERIFICATION_FAILED.code(),
                "Verification failed: " + error.getMessage(),
                Map.of("exception", error.getClass().getName())
            );
            LOGGER.log(Level.WARNING, error, () -> "[datafold-sdk] unexpected verification failure");
        }
        LOGGER.fine(() -> "[datafold-sdk] verification error " + resultError.code() + ": " + resultError.message());
        return VerificationResult.error(resultError, metrics);
    }

    private static VerificationResult batchError(Throwable error) {
        Throwable cause = PublicKeyResolver.unwrap(error);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", cause.getClass().getName());
        return VerificationResult.error(new ResultError(
            VerificationErrorCode.BATCH_VERIFICATION_ERROR.code(),
            "Batch verification failed: " + cause.getMessage(),
            details
        ), new PerformanceMetrics(0d, Map.of()));
    }

    /**
     * Timing state of one run. Stages execute one after another, so plain collections suffice.
     */
    private static final class Run {
        private final Instant verifiedAt;
        private final Stopwatch total = Stopwatch.start();
        private final Stopwatch step = Stopwatch.start();
        private final Map<String, Double> timings = new LinkedHashMap<>();

        private Run(Instant verifiedAt) {
            this.verifiedAt = verifiedAt;
        }

        void step(String name) {
            record(name, step.elapsedMillis());
            step.reset();
        }

        void record(String name, double millis) {
            timings.put(name, millis);
        }

        void check(Map<VerificationCheck, Boolean> checks, VerificationCheck check, BooleanSupplier body) {
            Stopwatch stopwatch = Stopwatch.start();
            checks.put(check, body.getAsBoolean());
            record(check.timingKey(), stopwatch.elapsedMillis());
        }

        PerformanceMetrics metrics() {
            return new PerformanceMetrics(total.elapsedMillis(), timings);
        }
    }
}
