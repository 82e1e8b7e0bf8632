package com.ewas.alerting.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate for remote classification models. Alert API clients build their own
 * per system from {@code alert-framework.systems.*.timeout}.
 */
@Configuration
public class WebConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, AlertFrameworkProperties properties) {
        AlertFrameworkProperties.ModelCacheSettings models = properties.getModelCache();
        return builder
            .setConnectTimeout(models.getConnectTimeout())
            .setReadTimeout(models.getReadTimeout())
            .build();
    }
}
