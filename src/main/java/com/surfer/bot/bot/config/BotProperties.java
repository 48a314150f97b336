package com.surfer.bot.bot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "app.bot")
public class BotProperties {

    /** webhook 路徑：POST /{webhookSecret} */
    private String webhookSecret;

    /** Telegram user id（字串比對） */
    private Set<String> adminIds = new LinkedHashSet<>();

    public boolean isAdmin(String userId) {
        if (userId == null || adminIds == null) return false;
        return adminIds.stream().anyMatch(a -> a != null && a.trim().equals(userId));
    }
}
