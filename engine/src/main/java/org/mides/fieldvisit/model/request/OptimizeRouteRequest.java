package org.mides.fieldvisit.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.fieldvisit.converter.DurationDeserializer;
import org.mides.fieldvisit.model.GeoPoint;
import org.mides.fieldvisit.model.Stop;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class OptimizeRouteRequest {

    @Valid
    @NotNull
    @JsonProperty("stops")
    private List<Stop> stops = new ArrayList<>();

    @Valid
    @JsonProperty("start_point")
    private GeoPoint startPoint;

    /* "HH:mm:ss"; the configured day start applies when absent */
    @JsonProperty("day_start")
    @JsonDeserialize(using = DurationDeserializer.class)
    private Duration dayStart;
}
