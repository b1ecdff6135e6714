package org.mides.fieldvisit.service;

import org.mides.fieldvisit.config.SignalConfiguration;
import org.mides.fieldvisit.model.StopCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class WebhookCompletionSignalService implements ICompletionSignalService {

    private static final Logger logger = LoggerFactory.getLogger(WebhookCompletionSignalService.class);

    private final RestClient restClient;
    private final SignalConfiguration signalConfig;

    @Autowired
    public WebhookCompletionSignalService(RestClient restClient, SignalConfiguration signalConfig) {
        this.restClient = restClient;
        this.signalConfig = signalConfig;
    }

    @Override
    public void publish(StopCompletedEvent event) {
        var url = signalConfig.getWebhookUrl();
        if (url == null || url.isBlank()) {
            logger.info("No downstream receiver configured, stop {} completion not forwarded", event.getStopId());
            return;
        }

        restClient.post()
            .uri(url)
            .contentType(MediaType.APPLICATION_JSON)
            .body(event)
            .retrieve()
            .toBodilessEntity();

        logger.debug("Forwarded completion of stop {} to {}", event.getStopId(), url);
    }
}
