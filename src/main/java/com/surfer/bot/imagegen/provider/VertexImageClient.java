package com.surfer.bot.imagegen.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.surfer.bot.imagegen.ImageGenerationClient;
import com.surfer.bot.imagegen.ImageGenerationException;
import com.surfer.bot.imagegen.ImageRequest;
import com.surfer.bot.imagegen.config.VertexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Base64;
import java.util.Map;

/**
 * Vertex AI imagegeneration:predict。一次請求一張圖，不 retry。
 */
@Slf4j
public class VertexImageClient implements ImageGenerationClient {

    private static final String PREDICT_PATH =
            "/v1/projects/{project}/locations/{location}/publishers/google/models/{model}:predict";

    private static final Map<String, String> SIZE_MAP = Map.of(
            "512", "512x512",
            "768", "768x768",
            "1024", "1024x1024"
    );

    private final RestClient http;
    private final VertexProperties props;
    private final ObjectMapper om;

    public VertexImageClient(RestClient http, VertexProperties props, ObjectMapper om) {
        this.http = http;
        this.props = props;
        this.om = om;
    }

    @Override
    public byte[] generate(ImageRequest request) {
        ObjectNode payload = buildPayload(request);
        long t0 = System.nanoTime();

        JsonNode resp;
        try {
            resp = http.post()
                    .uri(b -> b.path(PREDICT_PATH)
                            .queryParam("key", props.getApiKey())
                            .build(props.getProjectId(), props.getLocation(), props.getModel()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("vertex_http_error status={} latencyMs={}", status, elapsedMs(t0));
            throw new ImageGenerationException("IMAGE_PROVIDER_HTTP_" + status, status, e);
        } catch (RestClientException e) {
            log.warn("vertex_call_failed error={} latencyMs={}", e.getMessage(), elapsedMs(t0));
            throw new ImageGenerationException("IMAGE_PROVIDER_UNREACHABLE", null, e);
        }

        String enc = extractBase64(resp);
        if (enc == null) {
            log.warn("vertex_no_image latencyMs={}", elapsedMs(t0));
            throw new ImageGenerationException("IMAGE_PROVIDER_EMPTY");
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(enc);
        } catch (IllegalArgumentException e) {
            throw new ImageGenerationException("IMAGE_PROVIDER_BAD_BASE64", null, e);
        }
        if (bytes.length == 0) throw new ImageGenerationException("IMAGE_PROVIDER_EMPTY");

        log.info("vertex_image_ok bytes={} latencyMs={}", bytes.length, elapsedMs(t0));
        return bytes;
    }

    ObjectNode buildPayload(ImageRequest request) {
        ObjectNode root = om.createObjectNode();

        String prompt = request.prompt();
        ObjectNode params = om.createObjectNode();
        params.put("sampleCount", 1);
        params.put("imageSize", SIZE_MAP.getOrDefault(request.size() == null ? "1024" : request.size(), "1024x1024"));
        if (request.seed() != null) params.put("seed", request.seed());

        String neg = request.negative();
        if (neg != null && !neg.isBlank()) {
            params.put("negativePrompt", neg);
            prompt = prompt + ". Avoid: " + neg;
        }

        root.putArray("instances").addObject().put("prompt", prompt);
        root.set("parameters", params);
        return root;
    }

    private static String extractBase64(JsonNode resp) {
        if (resp == null) return null;
        JsonNode preds = resp.path("predictions");
        if (!preds.isArray() || preds.isEmpty()) return null;

        JsonNode p0 = preds.get(0);
        for (String field : new String[]{"bytesBase64Encoded", "b64", "imageBytes"}) {
            JsonNode v = p0.get(field);
            if (v != null && v.isTextual() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
