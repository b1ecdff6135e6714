package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.GeoPoint;
import org.mides.fieldvisit.model.RouteResult;
import org.mides.fieldvisit.model.Stop;

import java.time.Duration;
import java.util.List;

public interface IRouteOptimizer {
    /**
     * Orders the stops and estimates their times. Always returns a route for valid non-empty input;
     * provider problems degrade to the nearest-neighbor heuristic.
     *
     * @param startPoint optional depot the crew leaves from
     * @param dayStart optional departure time as an offset from midnight
     */
    RouteResult optimize(List<Stop> stops, GeoPoint startPoint, Duration dayStart);

    /**
     * Times the stops in the given order without reordering them.
     */
    RouteResult estimate(List<Stop> orderedStops, GeoPoint startPoint, Duration dayStart);
}
