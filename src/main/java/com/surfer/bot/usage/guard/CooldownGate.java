package com.surfer.bot.usage.guard;

import com.surfer.bot.usage.config.UsageProperties;
import com.surfer.bot.usage.ledger.DailyUsage;
import com.surfer.bot.usage.ledger.UsageLedger;
import com.surfer.bot.usage.model.CooldownDecision;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * 只看 last_ts 的間隔，不讀也不改 count（每日上限交給 {@link QuotaGate}）。
 * <p>
 * 放行時立刻把 last_ts 寫成 now，這發生在生成結果出來之前：
 * 生成失敗的請求仍會佔用 cooldown。
 */
@Component
@RequiredArgsConstructor
public class CooldownGate {

    private final UsageLedger ledger;
    private final UsageProperties props;
    private final Clock clock;

    public CooldownDecision checkAndUpdate(String userId) {
        return checkAndUpdate(userId, props.getCooldown());
    }

    public CooldownDecision checkAndUpdate(String userId, Duration minGap) {
        DailyUsage usage = ledger.getUsage(userId);
        double now = clock.millis() / 1000.0;
        double gap = minGap.toMillis() / 1000.0;

        // last_ts = 0.0：從未請求 / store 不可用 -> 一律放行
        if (!usage.neverRequested()) {
            double elapsed = now - usage.lastTs();
            if (elapsed < gap) {
                return CooldownDecision.reject((long) Math.ceil(gap - elapsed));
            }
        }

        // count 原樣寫回；寫失敗不影響放行
        ledger.setUsage(userId, usage.count(), now);
        return CooldownDecision.admit();
    }
}
