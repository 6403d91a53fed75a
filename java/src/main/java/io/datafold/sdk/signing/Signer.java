package io.datafold.sdk.signing;

import io.datafold.sdk.SignableMessage;

/**
 * Produces signature headers for outbound messages.
 */
public interface Signer {

    SignatureResult sign(SignableMessage message, SigningOptions options) throws SigningException;

    default SignatureResult sign(SignableMessage message) throws SigningException {
        return sign(message, SigningOptions.none());
    }
}
