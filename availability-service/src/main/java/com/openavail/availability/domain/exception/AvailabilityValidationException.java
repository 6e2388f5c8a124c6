package com.openavail.availability.domain.exception;

import com.openavail.common.exception.BusinessException;

/**
 * Base type for every business rule an availability request can violate.
 * Subtypes carry the offending values; the message is rendered from them and is
 * what callers see in the {@code "error"} field.
 */
public abstract class AvailabilityValidationException extends BusinessException {

    protected AvailabilityValidationException(String message, String errorCode) {
        super(message, errorCode);
    }

    protected AvailabilityValidationException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
