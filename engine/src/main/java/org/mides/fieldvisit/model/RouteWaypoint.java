package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.fieldvisit.converter.DurationSerializer;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteWaypoint {

    @JsonProperty("stop_order")
    private int stopOrder;

    @JsonProperty("stop")
    private Stop stop;

    /* Time of day the crew reaches the stop */
    @JsonProperty("arrival_time")
    @JsonSerialize(using = DurationSerializer.class)
    private Duration arrivalTime;

    /* Time of day service at the stop is expected to finish */
    @JsonProperty("eta")
    @JsonSerialize(using = DurationSerializer.class)
    private Duration eta;

    @JsonProperty("distance_from_previous_km")
    private double distanceFromPreviousKm;

    @JsonProperty("duration_from_previous_minutes")
    private double durationFromPreviousMinutes;
}
