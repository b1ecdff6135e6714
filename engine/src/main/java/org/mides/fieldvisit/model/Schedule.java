package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One day's route. Owns its stops; their order is the execution sequence.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Schedule {

    @JsonProperty("id")
    private String id;

    @JsonProperty("schedule_date")
    private LocalDate scheduleDate;

    @JsonProperty("status")
    @Builder.Default
    private ScheduleStatus status = ScheduleStatus.DRAFT;

    @JsonProperty("start_point")
    private GeoPoint startPoint;

    @JsonProperty("stops")
    @Builder.Default
    private List<Stop> stops = new ArrayList<>();

    @JsonProperty("total_stops")
    private int totalStops;

    @JsonProperty("total_items")
    private int totalItems;

    @JsonProperty("estimated_distance_km")
    private double estimatedDistanceKm;

    @JsonProperty("approximate_distance_km")
    private double approximateDistanceKm;

    @JsonProperty("estimated_duration_minutes")
    private long estimatedDurationMinutes;

    @JsonProperty("route_source")
    private RouteSource routeSource;

    @JsonProperty("optimized")
    private boolean optimized;

    @JsonProperty("polyline")
    private String polyline;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("created_by")
    private String createdBy;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("approved_by")
    private String approvedBy;

    @JsonProperty("approved_at")
    private Instant approvedAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("completed_by")
    private String completedBy;

    @JsonProperty("actual_duration_minutes")
    private Long actualDurationMinutes;

    public boolean allStopsTerminal() {
        return stops.stream().allMatch(stop -> stop.getStatus().isTerminal());
    }

    public List<Stop> unfinishedStops() {
        return stops.stream().filter(stop -> !stop.getStatus().isTerminal()).toList();
    }
}
