package io.datafold.sdk.keys;

import io.datafold.sdk.ErrorCategory;
import io.datafold.sdk.ErrorCode;

public enum KeyErrorCode implements ErrorCode {
    KEY_SERVICE_ERROR(ErrorCategory.TRANSPORT),
    KEY_SERVICE_UNAVAILABLE(ErrorCategory.TRANSPORT),
    INVALID_KEY_RESPONSE(ErrorCategory.FORMAT);

    private final ErrorCategory category;

    KeyErrorCode(ErrorCategory category) {
        this.category = category;
    }

    @Override
    public String code() {
        return name();
    }

    @Override
    public ErrorCategory category() {
        return category;
    }
}
