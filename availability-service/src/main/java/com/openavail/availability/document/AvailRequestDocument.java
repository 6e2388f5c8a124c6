package com.openavail.availability.document;

import com.openavail.availability.domain.model.Destination;
import lombok.Builder;

import java.util.List;

/**
 * Typed view of an availability request document, before any business rule is applied.
 * Optional fields are {@code null} when the document does not carry them.
 * Stay dates are kept as written (day/month/year) and parsed by the stay rule.
 */
@Builder(toBuilder = true)
public record AvailRequestDocument(
        String languageCode,
        Integer optionsQuota,
        String username,
        String password,
        String companyId,
        String searchType,
        List<Destination> destinations,
        String startDate,
        String endDate,
        String currency,
        String nationality,
        String market,
        List<RoomEntry> rooms
) {

    public AvailRequestDocument {
        destinations = destinations == null ? List.of() : List.copyOf(destinations);
        rooms = rooms == null ? List.of() : List.copyOf(rooms);
    }

    /**
     * One room block; ages in document order.
     */
    public record RoomEntry(List<Integer> ages) {

        public RoomEntry {
            ages = List.copyOf(ages);
        }
    }
}
