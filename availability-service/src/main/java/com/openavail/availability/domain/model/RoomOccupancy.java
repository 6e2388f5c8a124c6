package com.openavail.availability.domain.model;

import java.util.List;

/**
 * Travelers sharing one room, in document order.
 */
public record RoomOccupancy(List<Occupant> occupants) {

    public RoomOccupancy {
        occupants = List.copyOf(occupants);
    }

    public int childCount() {
        return (int) occupants.stream().filter(Occupant::isChild).count();
    }

    public int adultCount() {
        return occupants.size() - childCount();
    }

    public boolean hasUnaccompaniedChildren() {
        return childCount() > 0 && adultCount() == 0;
    }
}
