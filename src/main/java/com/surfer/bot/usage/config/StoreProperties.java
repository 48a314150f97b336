package com.surfer.bot.usage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.store")
public class StoreProperties {

    /** Firebase Realtime Database URL；空白 = 不啟用（ledger fail-open） */
    private String baseUrl;

    /** 可選：database secret / ID token，帶在 ?auth= */
    private String authToken;

    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(5);

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
