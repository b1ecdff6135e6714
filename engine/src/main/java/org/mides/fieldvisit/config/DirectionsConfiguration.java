package org.mides.fieldvisit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "directions")
public class DirectionsConfiguration {
    private boolean enabled;
    private String baseUrl;
    private String routeEndpoint;
    private String apiKey;
    private String mode = "driving";
    private Duration timeout = Duration.ofSeconds(5);

    public boolean isConfigured() {
        return enabled && baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }
}
