package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ScheduleStats {

    @JsonProperty("total")
    private long total;

    @JsonProperty("draft")
    private long draft;

    @JsonProperty("approved")
    private long approved;

    @JsonProperty("in_progress")
    private long inProgress;

    @JsonProperty("completed")
    private long completed;
}
