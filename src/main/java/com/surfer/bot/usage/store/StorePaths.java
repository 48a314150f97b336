package com.surfer.bot.usage.store;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Store 裡的 key 形狀：
 * <pre>
 * /usage/{userId}/{yyyy-MM-dd}            {count, last_ts}
 * /usage/{userId}/{yyyy-MM-dd}/count
 * /usage/{userId}/{yyyy-MM-dd}/last_ts
 * /usage_images/{yyyy-MM}/total_count
 * /limits/{userId}/daily
 * </pre>
 */
public final class StorePaths {

    private StorePaths() {}

    public static LocalDate day(Instant now, ZoneId zone) {
        return ZonedDateTime.ofInstant(now, zone).toLocalDate();
    }

    public static YearMonth month(Instant now, ZoneId zone) {
        return YearMonth.from(ZonedDateTime.ofInstant(now, zone));
    }

    public static String dailyUsage(String userId, LocalDate day) {
        return "/usage/" + userId + "/" + day;
    }

    public static String dailyCount(String userId, LocalDate day) {
        return dailyUsage(userId, day) + "/count";
    }

    public static String dailyLastTs(String userId, LocalDate day) {
        return dailyUsage(userId, day) + "/last_ts";
    }

    public static String monthlyTotal(YearMonth month) {
        // YearMonth.toString() = yyyy-MM
        return "/usage_images/" + month + "/total_count";
    }

    public static String dailyLimit(String userId) {
        return "/limits/" + userId + "/daily";
    }
}
