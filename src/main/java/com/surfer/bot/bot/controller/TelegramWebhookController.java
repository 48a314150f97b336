package com.surfer.bot.bot.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.surfer.bot.bot.command.CommandDispatcher;
import com.surfer.bot.bot.config.BotProperties;
import com.surfer.bot.bot.telegram.dto.TelegramUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Telegram webhook：POST /{secret}。每個 update 在自己的 servlet thread 上同步處理。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class TelegramWebhookController {

    public static final String MDC_KEY = "rid";

    private final CommandDispatcher dispatcher;
    private final BotProperties props;
    private final ObjectMapper om;

    @PostMapping("/{secret}")
    public ResponseEntity<String> webhook(
            @PathVariable("secret") String secret,
            @RequestBody(required = false) String body
    ) {
        if (props.getWebhookSecret() == null || !props.getWebhookSecret().equals(secret)) {
            return ResponseEntity.notFound().build();
        }
        if (body == null || body.isBlank()) {
            return ResponseEntity.badRequest().body("no data");
        }

        TelegramUpdate update;
        try {
            update = om.readValue(body, TelegramUpdate.class);
        } catch (JsonProcessingException e) {
            log.warn("webhook_bad_json error={}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body("no data");
        }
        if (update == null) {
            return ResponseEntity.badRequest().body("no data");
        }

        MDC.put(MDC_KEY, String.valueOf(update.updateId()));
        try {
            dispatcher.handle(update);
            return ResponseEntity.ok("ok");
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
