package org.mides.fieldvisit.model;

public enum PriorityLabel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static PriorityLabel fromScore(int score) {
        if (score >= 80)
            return CRITICAL;
        if (score >= 60)
            return HIGH;
        if (score >= 40)
            return MEDIUM;
        return LOW;
    }
}
