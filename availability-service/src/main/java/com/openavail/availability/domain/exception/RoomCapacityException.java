package com.openavail.availability.domain.exception;

import lombok.Getter;

@Getter
public class RoomCapacityException extends AvailabilityValidationException {

    private final int actual;
    private final int limit;
    /** 1-based room position, or 0 when the room count itself is exceeded. */
    private final int roomNumber;

    private RoomCapacityException(String message, int actual, int limit, int roomNumber) {
        super(message, "ROOM_CAPACITY_EXCEEDED");
        this.actual = actual;
        this.limit = limit;
        this.roomNumber = roomNumber;
    }

    public static RoomCapacityException tooManyRooms(int roomCount, int maxRooms) {
        return new RoomCapacityException(
                String.format("Number of rooms cannot exceed %d.", maxRooms), roomCount, maxRooms, 0);
    }

    public static RoomCapacityException tooManyGuests(int roomNumber, int guestCount, int maxGuests) {
        return new RoomCapacityException(
                String.format("Number of passengers in a room cannot exceed %d.", maxGuests),
                guestCount, maxGuests, roomNumber);
    }
}
