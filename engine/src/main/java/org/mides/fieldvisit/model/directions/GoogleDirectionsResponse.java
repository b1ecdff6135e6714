package org.mides.fieldvisit.model.directions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Wire shape of the Google Directions JSON API, reduced to the fields we read.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoogleDirectionsResponse {
    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    private List<GoogleRoute> routes;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GoogleRoute {
        @JsonProperty("waypoint_order")
        private List<Integer> waypointOrder;

        private List<GoogleLeg> legs;

        @JsonProperty("overview_polyline")
        private GooglePolyline overviewPolyline;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GoogleLeg {
        private GoogleValue distance;
        private GoogleValue duration;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GoogleValue {
        private String text;
        private long value;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GooglePolyline {
        private String points;
    }
}
