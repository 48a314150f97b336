package com.surfer.bot.usage.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.surfer.bot.usage.store.CounterStoreClient;
import com.surfer.bot.usage.store.StorePaths;
import com.surfer.bot.usage.store.StoreValues;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class RemoteUsageLedger implements UsageLedger {

    private final CounterStoreClient store;
    private final Clock clock;
    private final ZoneId zone;
    private final int defaultDailyLimit;

    public RemoteUsageLedger(CounterStoreClient store, Clock clock, ZoneId zone, int defaultDailyLimit) {
        this.store = store;
        this.clock = clock;
        this.zone = zone;
        this.defaultDailyLimit = defaultDailyLimit;
    }

    @Override
    public DailyUsage getUsage(String userId) {
        Optional<JsonNode> doc = store.read(StorePaths.dailyUsage(userId, today()));
        if (doc.isEmpty() || !doc.get().isObject()) return DailyUsage.ZERO;

        JsonNode n = doc.get();
        int count = StoreValues.nonNegativeInt(n.get("count")).orElse(0);
        double lastTs = StoreValues.nonNegativeDouble(n.get("last_ts")).orElse(0.0);
        return new DailyUsage(count, lastTs);
    }

    @Override
    public boolean setUsage(String userId, int count, double lastTs) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("count", count);
        doc.put("last_ts", lastTs);
        return store.write(StorePaths.dailyUsage(userId, today()), doc);
    }

    @Override
    public boolean incrementUsage(String userId) {
        Instant now = clock.instant();
        LocalDate day = StorePaths.day(now, zone);
        YearMonth month = StorePaths.month(now, zone);

        // 1) daily count：讀到壞值 / 讀失敗都當 0（與 absent 同義）
        String countPath = StorePaths.dailyCount(userId, day);
        int cur = store.read(countPath).flatMap(StoreValues::nonNegativeInt).orElse(0);
        // 到上限就停住，不讓 +1 溢位成負數（負數會被讀成 absent = 0）
        boolean countOk = store.write(countPath, (int) Math.min((long) cur + 1, Integer.MAX_VALUE));

        // 2) last_ts：不需要先讀
        boolean tsOk = store.write(StorePaths.dailyLastTs(userId, day), epochSeconds(now));

        // 3) 全站月總量
        String monthPath = StorePaths.monthlyTotal(month);
        long curMonth = store.read(monthPath).flatMap(StoreValues::nonNegativeLong).orElse(0L);
        boolean monthOk = store.write(monthPath, curMonth == Long.MAX_VALUE ? curMonth : curMonth + 1);

        boolean all = countOk && tsOk && monthOk;
        if (!all) {
            log.warn("usage_increment_partial user={} day={} countOk={} tsOk={} monthOk={}",
                    userId, day, countOk, tsOk, monthOk);
        }
        return all;
    }

    @Override
    public int getDailyLimit(String userId) {
        return store.read(StorePaths.dailyLimit(userId))
                .flatMap(StoreValues::nonNegativeInt)
                .filter(v -> v > 0)
                .orElse(defaultDailyLimit);
    }

    @Override
    public boolean setDailyLimit(String userId, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("DAILY_LIMIT_NOT_POSITIVE");
        return store.write(StorePaths.dailyLimit(userId), limit);
    }

    @Override
    public long getMonthlyTotal() {
        return store.read(StorePaths.monthlyTotal(StorePaths.month(clock.instant(), zone)))
                .flatMap(StoreValues::nonNegativeLong)
                .orElse(0L);
    }

    @Override
    public boolean resetUserDaily(String userId) {
        return setUsage(userId, 0, 0.0);
    }

    @Override
    public boolean resetMonthlyTotal() {
        return store.write(StorePaths.monthlyTotal(StorePaths.month(clock.instant(), zone)), 0);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private LocalDate today() {
        return StorePaths.day(clock.instant(), zone);
    }

    static double epochSeconds(Instant t) {
        return t.toEpochMilli() / 1000.0;
    }
}
