package org.mides.fieldvisit.model;

public enum CustomerTier {
    STANDARD(8),
    PREMIUM(15),
    VIP(25);

    private final int weight;

    CustomerTier(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
