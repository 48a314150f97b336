package com.surfer.bot.usage.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@Data
@Validated
@ConfigurationProperties(prefix = "app.usage")
public class UsageProperties {

    /** 沒有 /limits/{user}/daily override 時的每日上限 */
    @Min(1)
    private int defaultDailyLimit = 10;

    /** 全站每月圖片總量上限 */
    @Min(1)
    private int monthlyCap = 100;

    /** 同一 user 兩次請求的最小間隔 */
    @NotNull
    private Duration cooldown = Duration.ofSeconds(5);

    /** 日期 / 月份 key 用的時區；空白 = JVM 預設 */
    private String zone;

    public ZoneId resolveZone() {
        if (zone == null || zone.isBlank()) return ZoneId.systemDefault();
        return ZoneId.of(zone.trim());
    }
}
