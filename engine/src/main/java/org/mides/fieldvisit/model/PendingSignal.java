package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PendingSignal {

    @JsonProperty("event")
    private StopCompletedEvent event;

    @JsonProperty("attempts")
    private int attempts;

    @JsonProperty("last_error")
    private String lastError;
}
