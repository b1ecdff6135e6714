package org.mides.fieldvisit.service;

import org.mides.fieldvisit.config.DirectionsConfiguration;
import org.mides.fieldvisit.config.RoutingConfiguration;
import org.mides.fieldvisit.exception.ErrorCode;
import org.mides.fieldvisit.exception.ValidationException;
import org.mides.fieldvisit.exception.directions.QueryDirectionsException;
import org.mides.fieldvisit.model.GeoPoint;
import org.mides.fieldvisit.model.RouteResult;
import org.mides.fieldvisit.model.RouteSource;
import org.mides.fieldvisit.model.RouteWaypoint;
import org.mides.fieldvisit.model.Stop;
import org.mides.fieldvisit.model.directions.DirectionsLeg;
import org.mides.fieldvisit.model.directions.DirectionsResult;
import org.mides.fieldvisit.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.IntStream;

@Service
public class RouteOptimizer implements IRouteOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(RouteOptimizer.class);

    private static final int DEFAULT_SERVICE_MINUTES = 30;

    private final IDirectionsService directionsService;
    private final ExecutorService executorService;
    private final RoutingConfiguration routingConfig;
    private final DirectionsConfiguration directionsConfig;

    @Autowired
    public RouteOptimizer(
        IDirectionsService directionsService,
        ExecutorService executorService,
        RoutingConfiguration routingConfig,
        DirectionsConfiguration directionsConfig)
    {
        this.directionsService = directionsService;
        this.executorService = executorService;
        this.routingConfig = routingConfig;
        this.directionsConfig = directionsConfig;
    }

    @Override
    public RouteResult optimize(List<Stop> stops, GeoPoint startPoint, Duration dayStart) {
        validate(stops, startPoint);
        var departure = dayStart != null ? dayStart : routingConfig.getDayStart();

        if (stops.size() == 1) {
            return singleStop(stops.get(0), departure);
        }

        if (directionsService.isAvailable()) {
            try {
                return optimizeWithProvider(stops, startPoint, departure);
            } catch (QueryDirectionsException ex) {
                logger.warn("Directions provider unavailable for {} stops, using nearest neighbor: {}",
                    stops.size(), ex.getMessage());
            }
        } else {
            logger.debug("Directions provider not configured, using nearest neighbor for {} stops", stops.size());
        }

        return sequence(nearestNeighbor(stops, startPoint), startPoint, departure, RouteSource.FALLBACK);
    }

    @Override
    public RouteResult estimate(List<Stop> orderedStops, GeoPoint startPoint, Duration dayStart) {
        validate(orderedStops, startPoint);
        var departure = dayStart != null ? dayStart : routingConfig.getDayStart();
        return sequence(orderedStops, startPoint, departure, RouteSource.MANUAL);
    }

    private void validate(List<Stop> stops, GeoPoint startPoint) {
        if (stops == null || stops.isEmpty()) {
            throw new ValidationException(ErrorCode.EMPTY_STOP_SET, "At least one stop is required to build a route");
        }

        for (int i = 0; i < stops.size(); i++) {
            var stop = stops.get(i);
            if (stop == null || stop.getLocation() == null || !stop.getLocation().isValid()) {
                throw new ValidationException(ErrorCode.INVALID_COORDINATES, String.format(
                    "Stop %s (position %d) has missing or invalid coordinates",
                    stop != null ? stop.getId() : "null", i + 1));
            }
        }

        if (startPoint != null && !startPoint.isValid()) {
            throw new ValidationException(ErrorCode.INVALID_COORDINATES,
                "Start point has invalid coordinates: " + startPoint);
        }
    }

    private RouteResult singleStop(Stop stop, Duration dayStart) {
        var service = serviceDuration(stop);
        var placed = place(stop, 1, dayStart, dayStart.plus(service));

        var result = new RouteResult();
        result.setSource(RouteSource.SINGLE_STOP);
        result.getStops().add(placed);
        result.getWaypoints().add(new RouteWaypoint(1, placed, dayStart, dayStart.plus(service), 0, 0));
        result.setTotalDistanceKm(0);
        result.setApproximateDistanceKm(0);
        result.setTotalDurationMinutes(service.toMinutes());
        return result;
    }

    private RouteResult optimizeWithProvider(List<Stop> stops, GeoPoint startPoint, Duration dayStart) {
        int n = stops.size();
        var last = stops.get(n - 1);
        var origin = startPoint != null ? startPoint : stops.get(0).getLocation();
        /* Without a depot the first stop is the fixed origin and only the middle stops move */
        var movable = startPoint != null ? stops.subList(0, n - 1) : stops.subList(1, n - 1);
        var waypoints = movable.stream().map(Stop::getLocation).toList();

        var directions = queryDirections(origin, last.getLocation(), waypoints);
        if (!directions.isSuccess()) {
            throw new QueryDirectionsException("Directions returned status " + directions.getStatus());
        }

        var permutation = resolvePermutation(directions.getOrderedWaypointIndices(), movable.size());

        List<Stop> ordered = new ArrayList<>(n);
        if (startPoint == null) {
            ordered.add(stops.get(0));
        }
        permutation.forEach(index -> ordered.add(movable.get(index)));
        ordered.add(last);

        int expectedLegs = startPoint != null ? n : n - 1;
        var legs = directions.getLegs();
        if (legs == null || legs.size() != expectedLegs) {
            throw new QueryDirectionsException(String.format(
                "Directions returned %d legs, expected %d", legs == null ? 0 : legs.size(), expectedLegs));
        }

        var result = new RouteResult();
        result.setSource(RouteSource.PROVIDER);

        var clock = dayStart;
        long totalMeters = 0;
        for (int i = 0; i < n; i++) {
            var stop = ordered.get(i);
            DirectionsLeg arriving = startPoint != null ? legs.get(i) : (i > 0 ? legs.get(i - 1) : null);

            double legKm = 0;
            double legMinutes = 0;
            if (arriving != null) {
                clock = clock.plusSeconds(arriving.getDurationSeconds());
                totalMeters += arriving.getDistanceMeters();
                legKm = GeoUtils.metersToKm(arriving.getDistanceMeters());
                legMinutes = Math.round(arriving.getDurationSeconds() / 6.0) / 10.0;
            }

            var arrival = clock;
            clock = clock.plus(serviceDuration(stop));
            var placed = place(stop, i + 1, arrival, clock);

            result.getStops().add(placed);
            result.getWaypoints().add(new RouteWaypoint(i + 1, placed, arrival, clock, legKm, legMinutes));
        }

        result.setTotalDistanceKm(GeoUtils.metersToKm(totalMeters));
        result.setTotalDurationMinutes(Math.round(clock.minus(dayStart).getSeconds() / 60.0));
        result.setApproximateDistanceKm(approximateDistance(ordered, startPoint));

        var polyline = directions.getEncodedPolyline();
        if (polyline != null && !polyline.isEmpty()) {
            result.setPolyline(polyline);
            result.setGeometry(directions.decodePolyline());
        }

        logger.info("Provider ordered {} stops: {} km, {} min", n,
            result.getTotalDistanceKm(), result.getTotalDurationMinutes());
        return result;
    }

    private DirectionsResult queryDirections(GeoPoint origin, GeoPoint destination, List<GeoPoint> waypoints) {
        var timeout = directionsConfig.getTimeout();
        var future = CompletableFuture.supplyAsync(
            () -> directionsService.route(origin, destination, waypoints, true),
            executorService);

        try {
            var result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new QueryDirectionsException("Directions returned null");
            }
            return result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new QueryDirectionsException("Directions timed out after " + timeout.toMillis() + " ms", ex);
        } catch (ExecutionException ex) {
            var cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new QueryDirectionsException(cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new QueryDirectionsException("Interrupted while waiting for directions", ex);
        }
    }

    /* An absent order means the provider kept the request order */
    private List<Integer> resolvePermutation(List<Integer> order, int size) {
        if (order == null || order.isEmpty()) {
            return IntStream.range(0, size).boxed().toList();
        }

        if (order.size() != size) {
            throw new QueryDirectionsException(String.format(
                "Directions reordered %d waypoints, expected %d", order.size(), size));
        }

        var seen = new HashSet<Integer>();
        for (Integer index : order) {
            if (index == null || index < 0 || index >= size || !seen.add(index)) {
                throw new QueryDirectionsException("Directions returned an invalid waypoint order " + order);
            }
        }
        return order;
    }

    private List<Stop> nearestNeighbor(List<Stop> stops, GeoPoint startPoint) {
        List<Stop> remaining = new ArrayList<>(stops);
        List<Stop> ordered = new ArrayList<>(stops.size());

        GeoPoint current;
        if (startPoint != null) {
            current = startPoint;
        } else {
            var first = remaining.remove(0);
            ordered.add(first);
            current = first.getLocation();
        }

        while (!remaining.isEmpty()) {
            int nearestIndex = 0;
            double minDistance = Double.MAX_VALUE;

            for (int i = 0; i < remaining.size(); i++) {
                double distance = GeoUtils.haversineKm(current, remaining.get(i).getLocation());
                if (distance < minDistance) {
                    minDistance = distance;
                    nearestIndex = i;
                }
            }

            var next = remaining.remove(nearestIndex);
            ordered.add(next);
            current = next.getLocation();
        }

        return ordered;
    }

    /**
     * Times stops in the given order using the fixed travel allowance between them.
     * Drive distance is unknown here and reported as zero.
     */
    private RouteResult sequence(List<Stop> ordered, GeoPoint startPoint, Duration dayStart, RouteSource source) {
        var allowance = routingConfig.getFallbackTravelAllowance();
        var result = new RouteResult();
        result.setSource(source);

        var clock = dayStart;
        for (int i = 0; i < ordered.size(); i++) {
            var stop = ordered.get(i);
            boolean travels = i > 0 || startPoint != null;
            if (travels) {
                clock = clock.plus(allowance);
            }

            var arrival = clock;
            clock = clock.plus(serviceDuration(stop));
            var placed = place(stop, i + 1, arrival, clock);

            result.getStops().add(placed);
            result.getWaypoints().add(new RouteWaypoint(i + 1, placed, arrival, clock, 0,
                travels ? allowance.toMinutes() : 0));
        }

        result.setTotalDistanceKm(0);
        result.setApproximateDistanceKm(approximateDistance(ordered, startPoint));
        result.setTotalDurationMinutes(clock.minus(dayStart).toMinutes());
        return result;
    }

    private double approximateDistance(List<Stop> ordered, GeoPoint startPoint) {
        double total = 0;
        var current = startPoint != null ? startPoint : ordered.get(0).getLocation();
        for (var stop : ordered) {
            total += GeoUtils.haversineKm(current, stop.getLocation());
            current = stop.getLocation();
        }
        return GeoUtils.roundOneDecimal(total);
    }

    private Duration serviceDuration(Stop stop) {
        int minutes = stop.getEstimatedDurationMinutes() > 0 ? stop.getEstimatedDurationMinutes() : DEFAULT_SERVICE_MINUTES;
        return Duration.ofMinutes(minutes);
    }

    private Stop place(Stop stop, int order, Duration arrival, Duration eta) {
        var placed = stop.copy();
        placed.setStopOrder(order);
        placed.setPlannedArrival(arrival);
        placed.setEta(eta);
        return placed;
    }
}
