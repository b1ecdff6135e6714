package org.mides.fieldvisit.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.fieldvisit.model.GeoPoint;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class CreateScheduleRequest {

    @NotNull
    @JsonProperty("schedule_date")
    private LocalDate scheduleDate;

    /* Empty means: pick the highest ranked pending requests */
    @JsonProperty("service_request_ids")
    private List<String> serviceRequestIds = new ArrayList<>();

    @Valid
    @JsonProperty("start_point")
    private GeoPoint startPoint;

    @Size(max = 1000)
    @JsonProperty("notes")
    private String notes;
}
