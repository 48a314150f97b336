package com.surfer.bot.usage.guard;

import com.surfer.bot.usage.config.UsageProperties;
import com.surfer.bot.usage.ledger.UsageLedger;
import com.surfer.bot.usage.model.QuotaSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * count < dailyLimit 且 monthlyTotal < monthlyCap 才放行。
 * 只檢查不扣點；同一 user 的併發請求可能同時通過（短暫超發，上限取決於併發數）。
 */
@Component
@RequiredArgsConstructor
public class QuotaGate {

    private final UsageLedger ledger;
    private final UsageProperties props;

    public QuotaSnapshot check(String userId) {
        int limit = ledger.getDailyLimit(userId);
        int count = ledger.getUsage(userId).count();
        long monthly = ledger.getMonthlyTotal();
        return new QuotaSnapshot(count, limit, monthly, props.getMonthlyCap());
    }
}
