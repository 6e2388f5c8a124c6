package com.openavail.availability.domain.model;

import lombok.Builder;

import java.time.LocalDate;
import java.util.List;

/**
 * Availability request that passed every business rule.
 * Currency, nationality and market always hold allowed codes at this point.
 */
@Builder
public record ValidatedRequest(
        String languageCode,
        int optionsQuota,
        Credentials credentials,
        SearchType searchType,
        List<Destination> destinations,
        LocalDate stayStart,
        LocalDate stayEnd,
        String currency,
        String nationality,
        String market,
        List<RoomOccupancy> rooms
) {

    public ValidatedRequest {
        destinations = List.copyOf(destinations);
        rooms = List.copyOf(rooms);
    }
}
