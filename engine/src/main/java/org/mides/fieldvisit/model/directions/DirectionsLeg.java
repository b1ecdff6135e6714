package org.mides.fieldvisit.model.directions;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DirectionsLeg {
    private long distanceMeters;
    private long durationSeconds;
}
