package io.datafold.sdk.http;

/**
 * Observes or rewrites a response after it was received and, when enabled, verified.
 */
@FunctionalInterface
public interface ResponseInterceptor {

    SignedResponse intercept(SignedResponse response, RequestContext context);
}
