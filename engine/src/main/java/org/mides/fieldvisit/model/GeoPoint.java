package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeoPoint {
    @NotNull
    @JsonProperty("latitude")
    private Double latitude;

    @NotNull
    @JsonProperty("longitude")
    private Double longitude;

    @JsonIgnore
    public boolean isValid() {
        return latitude != null && longitude != null
            && !latitude.isNaN() && !longitude.isNaN()
            && latitude >= -90 && latitude <= 90
            && longitude >= -180 && longitude <= 180;
    }

    /* Directions providers expect "lat,lng" */
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.8f,%.8f", latitude, longitude);
    }
}
