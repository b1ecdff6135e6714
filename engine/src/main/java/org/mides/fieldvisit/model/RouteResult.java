package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Transient output of one optimization call. The caller persists the order.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteResult {

    @JsonProperty("stops")
    private List<Stop> stops = new ArrayList<>();

    @JsonProperty("waypoints")
    private List<RouteWaypoint> waypoints = new ArrayList<>();

    /* Drive distance from the provider; zero when the fallback ordered the route */
    @JsonProperty("total_distance_km")
    private double totalDistanceKm;

    @JsonProperty("total_duration_minutes")
    private long totalDurationMinutes;

    /* Straight-line distance along the chosen order */
    @JsonProperty("approximate_distance_km")
    private double approximateDistanceKm;

    @JsonProperty("source")
    private RouteSource source;

    @JsonProperty("polyline")
    private String polyline;

    @JsonProperty("geometry")
    private List<List<Double>> geometry;
}
