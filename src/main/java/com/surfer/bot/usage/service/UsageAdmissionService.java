package com.surfer.bot.usage.service;

import com.surfer.bot.usage.guard.CooldownGate;
import com.surfer.bot.usage.guard.QuotaGate;
import com.surfer.bot.usage.ledger.UsageLedger;
import com.surfer.bot.usage.model.AdmissionResult;
import com.surfer.bot.usage.model.CooldownDecision;
import com.surfer.bot.usage.model.QuotaSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;

/**
 * Cooldown -> Quota -> 生成 -> increment，四步在同一個 request thread 內依序執行。
 * 沒有鎖、沒有 transaction：併發請求之間沒有隔離，increment 可能只套用一部分。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageAdmissionService {

    private final CooldownGate cooldownGate;
    private final QuotaGate quotaGate;
    private final UsageLedger ledger;

    public <T> AdmissionResult<T> admitAndRecord(String userId, Callable<T> generation) {
        CooldownDecision cd = cooldownGate.checkAndUpdate(userId);
        if (!cd.admitted()) {
            log.info("admission_cooldown user={} retryAfterSec={}", userId, cd.retryAfterSec());
            return AdmissionResult.cooldownRejected(cd.retryAfterSec());
        }

        QuotaSnapshot quota = quotaGate.check(userId);
        if (!quota.admits()) {
            log.info("admission_quota_exceeded user={} daily={}/{} monthly={}/{}",
                    userId, quota.dailyCount(), quota.dailyLimit(), quota.monthlyTotal(), quota.monthlyCap());
            return AdmissionResult.quotaExceeded(quota);
        }

        T payload;
        try {
            payload = generation.call();
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            // 生成失敗不扣配額
            String code = failureCode(e);
            log.warn("admission_generation_failed user={} code={}", userId, code);
            return AdmissionResult.generationFailed(code);
        }
        if (payload == null) {
            log.warn("admission_generation_failed user={} code=EMPTY_RESULT", userId);
            return AdmissionResult.generationFailed("EMPTY_RESULT");
        }

        ledger.incrementUsage(userId);
        return AdmissionResult.admitted(payload, quota);
    }

    public QuotaSnapshot quotaSnapshot(String userId) {
        return quotaGate.check(userId);
    }

    private static String failureCode(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) return e.getClass().getSimpleName();
        return m;
    }
}
