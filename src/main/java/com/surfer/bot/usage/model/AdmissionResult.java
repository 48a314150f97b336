package com.surfer.bot.usage.model;

/**
 * @param payload       ADMITTED 時為生成結果，其它為 null
 * @param retryAfterSec COOLDOWN_REJECTED 時的剩餘秒數
 * @param quota         QUOTA_EXCEEDED / ADMITTED 時的配額狀態（increment 之前讀的）
 * @param failureCode   GENERATION_FAILED 時的錯誤碼
 */
public record AdmissionResult<T>(
        AdmissionOutcome outcome,
        T payload,
        Long retryAfterSec,
        QuotaSnapshot quota,
        String failureCode
) {

    public static <T> AdmissionResult<T> admitted(T payload, QuotaSnapshot quota) {
        return new AdmissionResult<>(AdmissionOutcome.ADMITTED, payload, null, quota, null);
    }

    public static <T> AdmissionResult<T> cooldownRejected(long retryAfterSec) {
        return new AdmissionResult<>(AdmissionOutcome.COOLDOWN_REJECTED, null, retryAfterSec, null, null);
    }

    public static <T> AdmissionResult<T> quotaExceeded(QuotaSnapshot quota) {
        return new AdmissionResult<>(AdmissionOutcome.QUOTA_EXCEEDED, null, null, quota, null);
    }

    public static <T> AdmissionResult<T> generationFailed(String failureCode) {
        return new AdmissionResult<>(AdmissionOutcome.GENERATION_FAILED, null, null, null, failureCode);
    }

    public boolean isAdmitted() {
        return outcome == AdmissionOutcome.ADMITTED;
    }
}
