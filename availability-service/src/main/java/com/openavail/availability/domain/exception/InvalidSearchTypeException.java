package com.openavail.availability.domain.exception;

import lombok.Getter;

@Getter
public class InvalidSearchTypeException extends AvailabilityValidationException {

    private final String searchType;

    public InvalidSearchTypeException(String searchType) {
        super("SearchType must be 'Single' or 'Multiple', got: " + searchType, "INVALID_SEARCH_TYPE");
        this.searchType = searchType;
    }
}
