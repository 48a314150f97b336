package com.surfer.bot.usage.ledger;

/**
 * 今天的使用量。{@code lastTs} 是 unix 秒（浮點），0.0 表示從未請求過。
 */
public record DailyUsage(int count, double lastTs) {

    public static final DailyUsage ZERO = new DailyUsage(0, 0.0);

    public boolean neverRequested() {
        return lastTs <= 0.0;
    }
}
