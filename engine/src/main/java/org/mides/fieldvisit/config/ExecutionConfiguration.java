package org.mides.fieldvisit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "execution")
public class ExecutionConfiguration {
    private int minSkipReasonLength = 10;
    private int maxSkipReasonLength = 500;
    private int signalMaxAttempts = 5;
    private Duration signalRetryInterval = Duration.ofSeconds(30);
}
