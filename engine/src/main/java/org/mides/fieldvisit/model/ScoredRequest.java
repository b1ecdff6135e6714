package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ScoredRequest {

    @JsonProperty("request")
    private ServiceRequest request;

    @JsonProperty("score")
    private int score;

    @JsonProperty("label")
    private PriorityLabel label;
}
