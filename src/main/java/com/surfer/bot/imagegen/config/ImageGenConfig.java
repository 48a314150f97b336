package com.surfer.bot.imagegen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.surfer.bot.imagegen.ImageGenerationClient;
import com.surfer.bot.imagegen.provider.UnconfiguredImageClient;
import com.surfer.bot.imagegen.provider.VertexImageClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class ImageGenConfig {

    /**
     * ✅ 只有 vertex enabled=false 才提供替身，避免 ImageGenerationClient 變成兩個 Bean
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.imagegen.vertex", name = "enabled", havingValue = "false", matchIfMissing = true)
    public ImageGenerationClient unconfiguredImageClient() {
        return new UnconfiguredImageClient();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.imagegen.vertex", name = "enabled", havingValue = "true")
    public ImageGenerationClient vertexImageClient(VertexProperties props, ObjectMapper om) {
        // Fail-fast：啟動就抓到設定缺失
        if (isBlank(props.getProjectId())) throw new IllegalStateException("VERTEX_PROJECT_ID_MISSING");
        if (isBlank(props.getApiKey())) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        if (isBlank(props.getLocation())) throw new IllegalStateException("VERTEX_LOCATION_MISSING");

        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        RestClient http = RestClient.builder()
                .baseUrl(props.resolveBaseUrl())
                .requestFactory(rf)
                .build();

        return new VertexImageClient(http, props, om);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
