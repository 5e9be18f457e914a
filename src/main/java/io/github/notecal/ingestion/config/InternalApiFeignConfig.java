package io.github.notecal.ingestion.config;

import feign.RequestInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;

public class InternalApiFeignConfig {

    static final String API_KEY_HEADER = "x-api-key";

    @Value("${app.security.internal-api-key}")
    private String internalApiKey;

    @Bean
    public RequestInterceptor internalApiKeyInterceptor() {
        return template -> template.header(API_KEY_HEADER, internalApiKey);
    }
}
