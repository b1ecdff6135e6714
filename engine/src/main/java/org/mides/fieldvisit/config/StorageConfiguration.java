package org.mides.fieldvisit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "storage")
public class StorageConfiguration {
    private String baseDir;
    private String publicBaseUrl;
}
