package com.openavail.availability.domain.exception;

import com.openavail.availability.domain.model.SearchType;
import lombok.Getter;

@Getter
public class DestinationCountException extends AvailabilityValidationException {

    private final SearchType searchType;
    private final int destinationCount;
    private final int limit;

    public DestinationCountException(SearchType searchType, int destinationCount, int limit) {
        super(describe(searchType, limit), "DESTINATION_COUNT_VIOLATION");
        this.searchType = searchType;
        this.destinationCount = destinationCount;
        this.limit = limit;
    }

    private static String describe(SearchType searchType, int limit) {
        if (searchType == SearchType.SINGLE) {
            return "If SearchType is 'Single', there must be exactly one destination.";
        }
        return String.format("If SearchType is '%s', there can be a maximum of %d destinations.",
                searchType.wireValue(), limit);
    }
}
