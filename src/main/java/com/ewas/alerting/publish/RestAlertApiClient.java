package com.ewas.alerting.publish;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.Map;

/**
 * AlertApiClient over HTTP/JSON.
 */
@Slf4j
public class RestAlertApiClient implements AlertApiClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
        new ParameterizedTypeReference<>() {};

    private final String systemName;
    private final String baseUrl;
    private final RestTemplate restTemplate;

    public RestAlertApiClient(String systemName, String baseUrl, RestTemplate restTemplate) {
        this.systemName = systemName;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.restTemplate = restTemplate;
    }

    @Override
    public String systemName() {
        return systemName;
    }

    @Override
    public Map<String, Object> publishAlert(Map<String, Object> payload) {
        String url = baseUrl + "/alerts";
        log.info("[ALERT-API] {} publishing alert {} to {}", systemName, payload.get("id"), url);
        Map<String, Object> result = call(HttpMethod.POST, url, payload);
        log.info("[ALERT-API] {} published alert: externalId={}", systemName, result.getOrDefault("id", "unknown"));
        return result;
    }

    @Override
    public Map<String, Object> updateAlert(String externalId, Map<String, Object> payload) {
        log.info("[ALERT-API] {} updating alert {}", systemName, externalId);
        return call(HttpMethod.PUT, baseUrl + "/alerts/" + externalId, payload);
    }

    @Override
    public Map<String, Object> cancelAlert(String externalId, String reason) {
        log.info("[ALERT-API] {} cancelling alert {}: {}", systemName, externalId, reason);
        return call(HttpMethod.POST, baseUrl + "/alerts/" + externalId + "/cancel", Map.of("reason", reason));
    }

    @Override
    public Map<String, Object> getAlertStatus(String externalId) {
        return call(HttpMethod.GET, baseUrl + "/alerts/" + externalId + "/status", null);
    }

    @Override
    public boolean healthCheck() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/health", String.class);
            return response.getStatusCode().value() == HttpStatus.OK.value();
        } catch (RestClientException e) {
            log.warn("[ALERT-API] {} health check failed: {}", systemName, e.getMessage());
            return false;
        }
    }

    private Map<String, Object> call(HttpMethod method, String url, Object body) {
        try {
            HttpEntity<?> request = body == null ? HttpEntity.EMPTY : new HttpEntity<>(body);
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(url, method, request, JSON_MAP);
            return response.getBody() == null ? Collections.emptyMap() : response.getBody();
        } catch (RestClientException e) {
            log.error("[ALERT-API] {} {} {} failed: {}", systemName, method, url, e.getMessage());
            throw e;
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
