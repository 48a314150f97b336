package com.surfer.bot.usage.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Firebase Realtime Database REST：{@code GET/PUT {baseUrl}{path}.json[?auth=token]}。
 * 沒有 retry；timeout 由 RestClient 的 request factory 決定。
 */
@Slf4j
public class FirebaseCounterStoreClient implements CounterStoreClient {

    private static final int MAX_SNIPPET_CHARS = 200;

    private final RestClient http;
    private final ObjectMapper om;
    private final String authToken;

    public FirebaseCounterStoreClient(RestClient http, ObjectMapper om, String authToken) {
        this.http = http;
        this.om = om;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken.trim();
    }

    @Override
    public Optional<JsonNode> read(String path) {
        String body;
        try {
            body = http.get()
                    .uri(b -> uri(b, path))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            log.warn("store_read_failed path={} status={} body={}",
                    path, e.getStatusCode().value(), shrink(e.getResponseBodyAsString()));
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("store_read_failed path={} error={}", path, e.getMessage());
            return Optional.empty();
        }

        // Firebase：從未寫過的 path 回 200 + "null"
        if (body == null || body.isBlank()) return Optional.empty();

        try {
            JsonNode node = om.readTree(body);
            if (node == null || node.isNull() || node.isMissingNode()) return Optional.empty();
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            log.warn("store_read_malformed path={} body={}", path, shrink(body));
            return Optional.empty();
        }
    }

    @Override
    public boolean write(String path, Object value) {
        String json;
        try {
            json = om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("store_write_unserializable path={} type={}", path,
                    value == null ? "null" : value.getClass().getSimpleName());
            return false;
        }

        try {
            http.put()
                    .uri(b -> uri(b, path))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(json)
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientResponseException e) {
            log.warn("store_write_failed path={} status={} body={}",
                    path, e.getStatusCode().value(), shrink(e.getResponseBodyAsString()));
            return false;
        } catch (RestClientException e) {
            log.warn("store_write_failed path={} error={}", path, e.getMessage());
            return false;
        }
    }

    /**
     * path 每一段都當 URI variable 展開（不當 template），userId 裡的 { } : 等字元一律被編碼。
     */
    private URI uri(UriBuilder b, String path) {
        Map<String, Object> vars = new HashMap<>();
        StringBuilder template = new StringBuilder();
        for (String seg : path.split("/")) {
            if (seg.isEmpty()) continue;
            String name = "s" + vars.size();
            vars.put(name, seg);
            template.append("/{").append(name).append('}');
        }
        template.append(".json");

        UriBuilder ub = b.path(template.toString());
        if (authToken != null) {
            vars.put("auth", authToken);
            ub = ub.queryParam("auth", "{auth}");
        }
        return ub.build(vars);
    }

    private static String shrink(String s) {
        if (s == null) return null;
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= MAX_SNIPPET_CHARS) return t;
        return t.substring(0, MAX_SNIPPET_CHARS) + "...";
    }
}
