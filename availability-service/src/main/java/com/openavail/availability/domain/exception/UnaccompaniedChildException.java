package com.openavail.availability.domain.exception;

import lombok.Getter;

@Getter
public class UnaccompaniedChildException extends AvailabilityValidationException {

    private final int roomNumber;
    private final int childCount;

    public UnaccompaniedChildException(int roomNumber, int childCount) {
        super(String.format("Children must have at least one accompanying adult (room %d).", roomNumber),
                "UNACCOMPANIED_CHILD");
        this.roomNumber = roomNumber;
        this.childCount = childCount;
    }
}
