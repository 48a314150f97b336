package com.surfer.bot.bot.web;

import com.surfer.bot.bot.controller.TelegramWebhookController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Webhook 的錯誤合約：任何漏出的例外都回 500 "error"（Telegram 之後會重送）。
 */
@Slf4j
@RestControllerAdvice(assignableTypes = TelegramWebhookController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class WebhookExceptionAdvice {

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnknown(Exception e) {
        log.error("webhook_error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("error");
    }
}
