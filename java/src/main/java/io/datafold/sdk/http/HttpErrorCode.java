package io.datafold.sdk.http;

import io.datafold.sdk.ErrorCategory;
import io.datafold.sdk.ErrorCode;

public enum HttpErrorCode implements ErrorCode {
    REQUEST_FAILED(ErrorCategory.TRANSPORT),
    REQUEST_INTERRUPTED(ErrorCategory.TRANSPORT),
    SERVER_ERROR(ErrorCategory.TRANSPORT),
    INVALID_RESPONSE(ErrorCategory.FORMAT),
    SIGNING_REQUIRED_FAILED(ErrorCategory.CRYPTOGRAPHIC);

    private final ErrorCategory category;

    HttpErrorCode(ErrorCategory category) {
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
