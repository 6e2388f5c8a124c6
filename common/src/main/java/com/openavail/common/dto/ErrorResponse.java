package com.openavail.common.dto;

import com.openavail.common.exception.BusinessException;

/**
 * Error body returned in place of a regular response.
 * Serializes as a single {@code "error"} field holding the violated rule's message.
 */
public record ErrorResponse(String error) {

    public static ErrorResponse from(BusinessException ex) {
        return new ErrorResponse(ex.getMessage());
    }
}
