package com.surfer.bot.usage.model;

/**
 * 一次讀取的配額狀態；各欄位是分開讀的，彼此之間沒有一致性保證。
 */
public record QuotaSnapshot(int dailyCount, int dailyLimit, long monthlyTotal, long monthlyCap) {

    public boolean dailyExhausted() {
        return dailyCount >= dailyLimit;
    }

    public boolean monthlyExhausted() {
        return monthlyTotal >= monthlyCap;
    }

    public boolean admits() {
        return !dailyExhausted() && !monthlyExhausted();
    }
}
