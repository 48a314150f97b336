package com.surfer.bot.bot.telegram;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bot API 出站呼叫。送失敗只記 log 回 false，不讓 webhook 失敗。
 */
@Slf4j
@Component
public class TelegramClient {

    private final RestClient http;
    private final TelegramProperties props;

    public TelegramClient(@Qualifier("telegramRestClient") RestClient http, TelegramProperties props) {
        this.http = http;
        this.props = props;
    }

    public boolean sendMessage(long chatId, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        return call("sendMessage", MediaType.APPLICATION_JSON, body);
    }

    public boolean sendPhoto(long chatId, byte[] png, String caption) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("chat_id", String.valueOf(chatId));
        parts.add("photo", new ByteArrayResource(png) {
            @Override
            public String getFilename() {
                return "image.png";
            }
        });
        if (caption != null && !caption.isBlank()) {
            parts.add("caption", caption);
        }
        return call("sendPhoto", MediaType.MULTIPART_FORM_DATA, parts);
    }

    public boolean setMyCommands(Map<String, String> commands) {
        List<Map<String, String>> list = commands.entrySet().stream()
                .map(e -> Map.of("command", e.getKey(), "description", e.getValue()))
                .toList();
        return call("setMyCommands", MediaType.APPLICATION_JSON, Map.of("commands", list));
    }

    private boolean call(String method, MediaType contentType, Object body) {
        if (!props.hasToken()) {
            log.warn("telegram_token_missing method={}", method);
            return false;
        }
        try {
            http.post()
                    .uri("/bot{token}/{method}", props.getToken(), method)
                    .contentType(contentType)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientResponseException e) {
            log.warn("telegram_call_failed method={} status={} body={}",
                    method, e.getStatusCode().value(), e.getResponseBodyAsString());
            return false;
        } catch (RestClientException e) {
            // message 內含完整 URI（token 在 path 上），只記例外類型
            log.warn("telegram_call_failed method={} error={} cause={}", method,
                    e.getClass().getSimpleName(),
                    NestedExceptionUtils.getMostSpecificCause(e).getClass().getSimpleName());
            return false;
        }
    }
}
