package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A completed stop plus whether the downstream signal went out on the first attempt.
 * An undelivered signal is retried in the background; the stop stays COMPLETED.
 */
@Data
@AllArgsConstructor
public class StopCompletionResult {

    @JsonProperty("stop")
    private Stop stop;

    @JsonProperty("signal_delivered")
    private boolean signalDelivered;
}
