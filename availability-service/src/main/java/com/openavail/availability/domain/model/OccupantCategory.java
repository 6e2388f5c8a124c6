package com.openavail.availability.domain.model;

public enum OccupantCategory {
    CHILD,
    ADULT;

    public static OccupantCategory forAge(int age, int childAgeThreshold) {
        return age <= childAgeThreshold ? CHILD : ADULT;
    }
}
