package com.janitor.client;

import com.janitor.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts deletion notices as {@code {"message": "..."}} JSON to a webhook.
 */
public class WebhookNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSink.class);

    private final RestTemplate restTemplate;
    private final String url;

    public WebhookNotificationSink(RestTemplate restTemplate, String url) {
        this.restTemplate = restTemplate;
        this.url = url;
    }

    @Override
    public void send(String message) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, Map.of("message", message), String.class);
        } catch (RestClientException e) {
            throw new TransportException("Failed to send webhook: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new TransportException("Webhook returned non-success status: " + response.getStatusCode());
        }
        log.debug("Webhook notification delivered to {}", url);
    }
}
