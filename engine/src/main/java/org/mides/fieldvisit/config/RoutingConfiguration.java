package org.mides.fieldvisit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "routing")
public class RoutingConfiguration {
    /* Offset from midnight at which crews leave */
    private Duration dayStart = Duration.ofHours(8);
    /* Travel time assumed between consecutive stops when no provider data exists */
    private Duration fallbackTravelAllowance = Duration.ofMinutes(15);
    private int maxStopsPerDay = 20;
}
