package com.surfer.bot.bot.telegram;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.telegram")
public class TelegramProperties {

    /** Bot token；空白時不會真的送訊息（只記 log） */
    private String token;

    private String baseUrl = "https://api.telegram.org";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);

    /** 啟動時呼叫 setMyCommands */
    private boolean registerCommands = true;

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
