package com.surfer.bot.bot.telegram.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Telegram Update 只取用得到的欄位；edited_message 視同 message 不處理。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(
        @JsonProperty("update_id") Long updateId,
        TelegramMessage message
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TelegramMessage(
            @JsonProperty("message_id") Long messageId,
            TelegramUser from,
            TelegramChat chat,
            String text
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TelegramUser(
            Long id,
            String username,
            @JsonProperty("first_name") String firstName
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TelegramChat(Long id, String type) {}
}
