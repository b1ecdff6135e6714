package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.GeoPoint;
import org.mides.fieldvisit.model.directions.DirectionsResult;

import java.util.List;

public interface IDirectionsService {
    boolean isAvailable();

    /**
     * @throws org.mides.fieldvisit.exception.directions.QueryDirectionsException on transport
     *     failure or any non-success status
     */
    DirectionsResult route(GeoPoint origin, GeoPoint destination, List<GeoPoint> waypoints, boolean optimizeWaypoints);
}
