package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Downstream notification emitted once per completed stop.
 * {@code stopId} doubles as the idempotency key for receivers.
 */
@Value
@Builder
public class StopCompletedEvent {

    @JsonProperty("stop_id")
    String stopId;

    @JsonProperty("schedule_id")
    String scheduleId;

    @JsonProperty("service_request_id")
    String serviceRequestId;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("items_removed")
    int itemsRemoved;

    @JsonProperty("items_installed")
    int itemsInstalled;

    @JsonProperty("issues")
    String issues;

    @JsonProperty("customer_feedback")
    String customerFeedback;

    @JsonProperty("completed_by")
    String completedBy;

    @JsonProperty("completed_at")
    Instant completedAt;
}
