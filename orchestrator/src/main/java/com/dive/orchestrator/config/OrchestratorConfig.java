package com.dive.orchestrator.config;

import com.dive.orchestrator.pipeline.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    /** Single time source for lock expiry, breaker cool-downs and checkpoints. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /** Shared by the federation client and the HTTP health probe. */
    @Bean
    HttpClient httpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    RetryPolicy retryPolicy(@Value("${dive.orchestrator.retry.max-attempts:3}") int maxAttempts,
                            @Value("${dive.orchestrator.retry.initial-delay:2s}") Duration initialDelay,
                            @Value("${dive.orchestrator.retry.multiplier:2.0}") double multiplier,
                            @Value("${dive.orchestrator.retry.max-delay:60s}") Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, multiplier, maxDelay);
    }
}
