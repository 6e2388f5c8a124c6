package com.openavail.common.exception;

import lombok.Getter;

/**
 * Business exception for domain-specific errors.
 * Used when business rules are violated; the error code lets callers
 * tell failures apart without parsing the message.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
