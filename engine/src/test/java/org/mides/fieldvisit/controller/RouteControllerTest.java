package org.mides.fieldvisit.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mides.fieldvisit.model.GeoPoint;
import org.mides.fieldvisit.model.Stop;
import org.mides.fieldvisit.model.directions.DirectionsLeg;
import org.mides.fieldvisit.model.directions.DirectionsResult;
import org.mides.fieldvisit.model.request.OptimizeRouteRequest;
import org.mides.fieldvisit.service.IDirectionsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class RouteControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private IDirectionsService directionsService;

    private Stop stop(String id, double latitude, double longitude, int minutes) {
        return Stop.builder()
            .id(id)
            .location(new GeoPoint(latitude, longitude))
            .estimatedDurationMinutes(minutes)
            .quantity(1)
            .build();
    }

    private OptimizeRouteRequest problem(List<Stop> stops) {
        var request = new OptimizeRouteRequest();
        request.setStops(stops);
        return request;
    }

    @Test
    void optimize_providerAvailable_shouldReturnProviderOrder() throws Exception {
        // Arrange
        var result = new DirectionsResult();
        result.setStatus(DirectionsResult.STATUS_OK);
        result.setOrderedWaypointIndices(List.of(2, 0, 1));
        result.setLegs(List.of(
            new DirectionsLeg(1500, 300),
            new DirectionsLeg(2500, 600),
            new DirectionsLeg(500, 120),
            new DirectionsLeg(4000, 900)));
        when(directionsService.isAvailable()).thenReturn(true);
        when(directionsService.route(any(), any(), anyList(), eq(true))).thenReturn(result);

        var stops = List.of(
            stop("first", 10.77, 106.70, 20),
            stop("a", 10.78, 106.71, 20),
            stop("b", 10.79, 106.72, 20),
            stop("c", 10.80, 106.73, 20),
            stop("last", 10.81, 106.74, 20));

        // Act & Assert
        mockMvc.perform(MockMvcRequestBuilders.post("/routes/optimize")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(problem(stops))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("PROVIDER"))
            .andExpect(jsonPath("$.stops[*].id").value(contains("first", "c", "a", "b", "last")))
            .andExpect(jsonPath("$.stops[0].planned_arrival").value("08:00:00"))
            .andExpect(jsonPath("$.stops[1].planned_arrival").value("08:25:00"))
            .andExpect(jsonPath("$.total_distance_km").value(8.5))
            .andExpect(jsonPath("$.waypoints.length()").value(5));
    }

    @Test
    void optimize_providerDown_shouldFallBackWithDayStart() throws Exception {
        when(directionsService.isAvailable()).thenReturn(false);

        var request = problem(List.of(stop("x", 10.77, 106.70, 45), stop("y", 10.78, 106.70, 30)));
        var json = objectMapper.writeValueAsString(request).replace("\"day_start\":null", "\"day_start\":\"7:30\"");

        mockMvc.perform(MockMvcRequestBuilders.post("/routes/optimize")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("FALLBACK"))
            .andExpect(jsonPath("$.total_distance_km").value(0.0))
            .andExpect(jsonPath("$.stops[0].planned_arrival").value("07:30:00"))
            .andExpect(jsonPath("$.stops[1].planned_arrival").value("08:30:00"))
            .andExpect(jsonPath("$.stops[1].eta").value("09:00:00"));
    }

    @Test
    void optimize_emptyStops_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routes/optimize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"stops\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("EMPTY_STOP_SET"));
    }

    @Test
    void optimize_nonPositiveServiceTime_shouldReturnInvalidInput() throws Exception {
        var stops = List.of(stop("ok", 10.77, 106.70, 30), stop("instant", 10.78, 106.71, 0));

        mockMvc.perform(MockMvcRequestBuilders.post("/routes/optimize")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(problem(stops))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
            .andExpect(jsonPath("$.message").value(containsString("estimatedDurationMinutes")));
    }

    @Test
    void optimize_invalidCoordinates_shouldReturnBadRequest() throws Exception {
        var stops = List.of(stop("ok", 10.77, 106.70, 30), stop("broken", 10.78, 190.0, 30));

        mockMvc.perform(MockMvcRequestBuilders.post("/routes/optimize")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(problem(stops))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_COORDINATES"))
            .andExpect(jsonPath("$.message").value(containsString("broken")));
    }
}
