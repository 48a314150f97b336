package com.surfer.bot.usage.ledger;

/**
 * Store 未設定時使用：不記錄任何使用量，所有讀取回預設值（fail-open）。
 */
public class DisabledUsageLedger implements UsageLedger {

    private final int defaultDailyLimit;

    public DisabledUsageLedger(int defaultDailyLimit) {
        this.defaultDailyLimit = defaultDailyLimit;
    }

    @Override
    public DailyUsage getUsage(String userId) {
        return DailyUsage.ZERO;
    }

    @Override
    public boolean setUsage(String userId, int count, double lastTs) {
        return false;
    }

    @Override
    public boolean incrementUsage(String userId) {
        return false;
    }

    @Override
    public int getDailyLimit(String userId) {
        return defaultDailyLimit;
    }

    @Override
    public boolean setDailyLimit(String userId, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("DAILY_LIMIT_NOT_POSITIVE");
        return false;
    }

    @Override
    public long getMonthlyTotal() {
        return 0L;
    }

    @Override
    public boolean resetUserDaily(String userId) {
        return false;
    }

    @Override
    public boolean resetMonthlyTotal() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
