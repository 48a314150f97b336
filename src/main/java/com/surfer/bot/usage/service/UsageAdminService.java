package com.surfer.bot.usage.service;

import com.surfer.bot.usage.ledger.UsageLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 管理員覆寫。權限由指令分派層判斷；這裡只做無條件覆寫 + log，沒有 audit trail。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageAdminService {

    private final UsageLedger ledger;

    public boolean resetUserDaily(String actorId, String targetUserId) {
        boolean ok = ledger.resetUserDaily(targetUserId);
        log.info("admin_reset_daily actor={} target={} ok={}", actorId, targetUserId, ok);
        return ok;
    }

    public boolean resetMonthlyTotal(String actorId) {
        boolean ok = ledger.resetMonthlyTotal();
        log.info("admin_reset_monthly actor={} ok={}", actorId, ok);
        return ok;
    }

    /**
     * @throws IllegalArgumentException limit <= 0
     */
    public boolean setDailyLimit(String actorId, String targetUserId, int limit) {
        boolean ok = ledger.setDailyLimit(targetUserId, limit);
        log.info("admin_set_limit actor={} target={} limit={} ok={}", actorId, targetUserId, limit, ok);
        return ok;
    }

    public boolean storeAvailable() {
        return ledger.isAvailable();
    }
}
