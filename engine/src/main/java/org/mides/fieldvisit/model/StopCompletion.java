package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome recorded by field staff. Stored verbatim, never recomputed.
 */
@Value
@Builder
public class StopCompletion {

    @JsonProperty("arrived_at")
    Instant arrivedAt;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("items_removed")
    int itemsRemoved;

    @JsonProperty("items_installed")
    int itemsInstalled;

    @JsonProperty("issues")
    String issues;

    @JsonProperty("customer_feedback")
    String customerFeedback;

    @JsonProperty("photo_urls")
    List<String> photoUrls;

    @JsonProperty("completed_by")
    String completedBy;
}
