package org.mides.fieldvisit.service;

import org.mides.fieldvisit.config.DirectionsConfiguration;
import org.mides.fieldvisit.exception.directions.QueryDirectionsException;
import org.mides.fieldvisit.model.GeoPoint;
import org.mides.fieldvisit.model.directions.DirectionsLeg;
import org.mides.fieldvisit.model.directions.DirectionsResult;
import org.mides.fieldvisit.model.directions.GoogleDirectionsResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class GoogleDirectionsService implements IDirectionsService {

    private final RestClient restClient;
    private final DirectionsConfiguration directionsConfig;

    @Autowired
    public GoogleDirectionsService(RestClient restClient, DirectionsConfiguration directionsConfig) {
        this.restClient = restClient;
        this.directionsConfig = directionsConfig;
    }

    @Override
    public boolean isAvailable() {
        return directionsConfig.isConfigured();
    }

    private String parseWaypoints(List<GeoPoint> waypoints, boolean optimizeWaypoints) {
        var joined = waypoints
            .stream()
            .map(GeoPoint::toString)
            .collect(Collectors.joining("|"));
        return optimizeWaypoints ? "optimize:true|" + joined : joined;
    }

    private String generateRouteRequestTemplate(boolean hasWaypoints) {
        return String.format("%s/%s?origin={origin}&destination={destination}%s&mode={mode}&key={key}",
            directionsConfig.getBaseUrl(),
            directionsConfig.getRouteEndpoint(),
            hasWaypoints ? "&waypoints={waypoints}" : "");
    }

    @Override
    public DirectionsResult route(GeoPoint origin, GeoPoint destination, List<GeoPoint> waypoints, boolean optimizeWaypoints) {
        Map<String, String> variables = new HashMap<>();
        variables.put("origin", origin.toString());
        variables.put("destination", destination.toString());
        variables.put("mode", directionsConfig.getMode());
        variables.put("key", directionsConfig.getApiKey());
        if (!waypoints.isEmpty()) {
            variables.put("waypoints", parseWaypoints(waypoints, optimizeWaypoints));
        }

        GoogleDirectionsResponse response;
        try {
            response = restClient.get()
                .uri(generateRouteRequestTemplate(!waypoints.isEmpty()), variables)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(GoogleDirectionsResponse.class);
        }
        catch (RuntimeException ex) {
            throw new QueryDirectionsException("Directions request failed: " + ex.getLocalizedMessage(), ex);
        }

        if (response == null) {
            throw new QueryDirectionsException("Directions returned null");
        }

        if (!DirectionsResult.STATUS_OK.equals(response.getStatus())) {
            throw new QueryDirectionsException(String.format("Directions returned status %s%s",
                response.getStatus(),
                response.getErrorMessage() != null ? ": " + response.getErrorMessage() : ""));
        }

        if (response.getRoutes() == null || response.getRoutes().isEmpty()) {
            throw new QueryDirectionsException("Directions returned no route");
        }

        return toResult(response.getStatus(), response.getRoutes().get(0));
    }

    private DirectionsResult toResult(String status, GoogleDirectionsResponse.GoogleRoute route) {
        var result = new DirectionsResult();
        result.setStatus(status);

        if (route.getWaypointOrder() != null) {
            result.setOrderedWaypointIndices(new ArrayList<>(route.getWaypointOrder()));
        }

        List<DirectionsLeg> legs = new ArrayList<>();
        if (route.getLegs() != null) {
            for (var leg : route.getLegs()) {
                long meters = leg.getDistance() != null ? leg.getDistance().getValue() : 0;
                long seconds = leg.getDuration() != null ? leg.getDuration().getValue() : 0;
                legs.add(new DirectionsLeg(meters, seconds));
            }
        }
        result.setLegs(legs);

        if (route.getOverviewPolyline() != null) {
            result.setEncodedPolyline(route.getOverviewPolyline().getPoints());
        }
        return result;
    }
}
