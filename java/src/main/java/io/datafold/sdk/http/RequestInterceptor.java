package io.datafold.sdk.http;

import io.datafold.sdk.SignableMessage;

/**
 * Rewrites an outgoing request before it is signed and sent. Interceptors run in registration order; one that throws
 * is logged and skipped.
 */
@FunctionalInterface
public interface RequestInterceptor {

    SignableMessage intercept(SignableMessage request, RequestContext context);
}
