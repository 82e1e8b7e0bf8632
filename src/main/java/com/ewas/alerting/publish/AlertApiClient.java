package com.ewas.alerting.publish;

import java.util.Map;

/**
 * Client of one external alert dissemination system.
 *
 * Failures surface as {@link org.springframework.web.client.RestClientException}; the
 * caller decides whether to retry.
 */
public interface AlertApiClient {

    String systemName();

    /**
     * POST /alerts. The response's {@code id} is the external id.
     */
    Map<String, Object> publishAlert(Map<String, Object> payload);

    /**
     * PUT /alerts/{id}
     */
    Map<String, Object> updateAlert(String externalId, Map<String, Object> payload);

    /**
     * POST /alerts/{id}/cancel with body {@code {"reason": ...}}
     */
    Map<String, Object> cancelAlert(String externalId, String reason);

    /**
     * GET /alerts/{id}/status
     */
    Map<String, Object> getAlertStatus(String externalId);

    /**
     * GET /health; true only on HTTP 200. Never throws.
     */
    boolean healthCheck();
}
