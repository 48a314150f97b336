package com.surfer.bot.usage.model;

public record CooldownDecision(boolean admitted, long retryAfterSec) {

    public static CooldownDecision admit() {
        return new CooldownDecision(true, 0);
    }

    public static CooldownDecision reject(long retryAfterSec) {
        return new CooldownDecision(false, Math.max(1, retryAfterSec));
    }
}
