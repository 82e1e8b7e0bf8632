package com.ewas.alerting.publish;

import com.ewas.alerting.config.AlertFrameworkProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link AlertApiClient} per system configured under {@code alert-framework.systems}.
 */
@Slf4j
@Component
public class AlertApiClientRegistry {

    static final String USER_AGENT = "EWAS-AlertFramework/1.0";

    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Map<String, AlertApiClient> clients;

    @Autowired
    public AlertApiClientRegistry(AlertFrameworkProperties properties, RestTemplateBuilder builder) {
        Map<String, AlertApiClient> built = new LinkedHashMap<>();
        properties.getSystems().forEach((name, system) -> {
            if (system.getBaseUrl() == null || system.getBaseUrl().isBlank()) {
                log.error("[ALERT-API] System {} has no base-url, skipping", name);
                return;
            }
            built.put(name, new RestAlertApiClient(name, system.getBaseUrl(), restTemplateFor(builder, system)));
            log.info("[ALERT-API] Initialized client {} -> {} (timeout={}s)",
                name, system.getBaseUrl(), system.getTimeout().toSeconds());
        });
        this.clients = Collections.unmodifiableMap(built);
    }

    public AlertApiClientRegistry(Map<String, AlertApiClient> clients) {
        this.clients = Collections.unmodifiableMap(new LinkedHashMap<>(clients));
    }

    public Optional<AlertApiClient> find(String systemName) {
        return Optional.ofNullable(clients.get(systemName));
    }

    public List<String> systemNames() {
        return new ArrayList<>(clients.keySet());
    }

    public Map<String, SystemHealth> checkHealth() {
        Map<String, SystemHealth> health = new LinkedHashMap<>();
        clients.forEach((name, client) -> {
            try {
                health.put(name, client.healthCheck() ? SystemHealth.up() : SystemHealth.down());
            } catch (RuntimeException e) {
                health.put(name, SystemHealth.error(e.getMessage()));
            }
        });
        return health;
    }

    private static RestTemplate restTemplateFor(
            RestTemplateBuilder builder, AlertFrameworkProperties.ExternalSystem system) {
        RestTemplateBuilder configured = builder
            .setConnectTimeout(MAX_CONNECT_TIMEOUT.compareTo(system.getTimeout()) < 0 ? MAX_CONNECT_TIMEOUT : system.getTimeout())
            .setReadTimeout(system.getTimeout())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT);
        if (system.getApiKey() != null && !system.getApiKey().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + system.getApiKey());
        }
        return configured.build();
    }
}
