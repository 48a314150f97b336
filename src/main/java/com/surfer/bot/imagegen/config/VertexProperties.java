package com.surfer.bot.imagegen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.imagegen.vertex")
public class VertexProperties {

    /** 開關：沒 key 的環境預設關閉 */
    private boolean enabled = false;

    private String projectId;

    private String location = "us-central1";

    /** 用環境變數帶入：GEMINI_API_KEY */
    private String apiKey;

    /** 空白 = https://{location}-aiplatform.googleapis.com */
    private String baseUrl;

    private String model = "imagegeneration";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(120);

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) return baseUrl.trim();
        return "https://" + location + "-aiplatform.googleapis.com";
    }
}
