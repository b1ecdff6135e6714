package org.mides.fieldvisit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "signal")
public class SignalConfiguration {
    /* Receiver of stop-completion events; blank disables delivery */
    private String webhookUrl;
}
