package com.surfer.bot.usage.model;

public enum AdmissionOutcome {
    ADMITTED,
    COOLDOWN_REJECTED,
    QUOTA_EXCEEDED,
    /** 外部生成失敗；不扣配額 */
    GENERATION_FAILED
}
