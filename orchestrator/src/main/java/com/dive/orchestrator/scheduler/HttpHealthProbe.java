package com.dive.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Default probe: HTTP GET on the service's health URL, healthy on 2xx.
 *
 * A service without a health URL is reported healthy, so its readiness
 * rests on the container start alone. Connection failures mean "not yet
 * healthy"; the scheduler's deadline decides when to give up.
 */
@Component
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient http;

    public HttpHealthProbe(HttpClient http) {
        this.http = http;
    }

    @Override
    public boolean isHealthy(String instanceCode, ServiceNode service) {
        if (service.healthUrl() == null || service.healthUrl().isBlank()) {
            return true;
        }
        URI uri = URI.create(service.healthUrl().replace("{instance}", instanceCode));
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(PROBE_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
            boolean healthy = resp.statusCode() >= 200 && resp.statusCode() < 300;
            log.debug("Health of {}/{} at {}: HTTP {}", instanceCode, service.name(), uri, resp.statusCode());
            return healthy;
        } catch (IOException e) {
            log.debug("Health of {}/{} at {}: {}", instanceCode, service.name(), uri, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
