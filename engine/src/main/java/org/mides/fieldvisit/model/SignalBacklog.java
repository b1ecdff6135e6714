package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class SignalBacklog {

    @JsonProperty("pending")
    private List<PendingSignal> pending;

    /* Gave up after the configured number of attempts */
    @JsonProperty("parked")
    private List<PendingSignal> parked;
}
