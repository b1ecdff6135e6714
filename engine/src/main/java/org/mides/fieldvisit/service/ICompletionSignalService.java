package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.StopCompletedEvent;

/**
 * One-way notification to inventory and customer-care records.
 * Receivers should treat {@code stopId} as an idempotency key.
 */
public interface ICompletionSignalService {
    void publish(StopCompletedEvent event);
}
