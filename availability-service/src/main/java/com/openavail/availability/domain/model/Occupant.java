package com.openavail.availability.domain.model;

public record Occupant(int age, OccupantCategory category) {

    public static Occupant of(int age, int childAgeThreshold) {
        return new Occupant(age, OccupantCategory.forAge(age, childAgeThreshold));
    }

    public boolean isChild() {
        return category == OccupantCategory.CHILD;
    }
}
