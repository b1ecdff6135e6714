package org.mides.fieldvisit.model;

public enum UrgencyTier {
    LOW(5),
    MEDIUM(15),
    HIGH(30),
    URGENT(40);

    private final int weight;

    UrgencyTier(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
