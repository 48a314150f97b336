package com.surfer.bot.usage.guard;

import com.surfer.bot.testsupport.InMemoryCounterStore;
import com.surfer.bot.testsupport.MutableClock;
import com.surfer.bot.usage.config.UsageProperties;
import com.surfer.bot.usage.ledger.DailyUsage;
import com.surfer.bot.usage.ledger.DisabledUsageLedger;
import com.surfer.bot.usage.ledger.RemoteUsageLedger;
import com.surfer.bot.usage.model.CooldownDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownGateTest {

    private static final Instant T0 = Instant.parse("2026-02-03T10:00:00Z");

    private InMemoryCounterStore store;
    private MutableClock clock;
    private RemoteUsageLedger ledger;
    private CooldownGate gate;

    @BeforeEach
    void setUp() {
        store = new InMemoryCounterStore();
        clock = new MutableClock(T0);
        ledger = new RemoteUsageLedger(store, clock, ZoneOffset.UTC, 10);

        UsageProperties props = new UsageProperties();
        props.setCooldown(Duration.ofSeconds(5));
        gate = new CooldownGate(ledger, props, clock);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 5, 30})
    void second_call_within_gap_is_rejected(int gapSec) {
        Duration gap = Duration.ofSeconds(gapSec);

        CooldownDecision first = gate.checkAndUpdate("7", gap);
        clock.advance(gap.minusMillis(1));
        CooldownDecision second = gate.checkAndUpdate("7", gap);

        assertThat(first.admitted()).isTrue();
        assertThat(second.admitted()).isFalse();
        assertThat(second.retryAfterSec()).isBetween(1L, (long) gapSec);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 5, 30})
    void second_call_after_gap_is_admitted(int gapSec) {
        Duration gap = Duration.ofSeconds(gapSec);

        CooldownDecision first = gate.checkAndUpdate("7", gap);
        clock.advance(gap);
        CooldownDecision second = gate.checkAndUpdate("7", gap);

        assertThat(first.admitted()).isTrue();
        assertThat(second.admitted()).isTrue();
    }

    @Test
    void admit_stamps_last_ts_and_keeps_count() {
        store.seed("/usage/7/2026-02-03", Map.of("count", 4, "last_ts", 0.0));

        assertThat(gate.checkAndUpdate("7").admitted()).isTrue();

        assertThat(ledger.getUsage("7")).isEqualTo(new DailyUsage(4, T0.toEpochMilli() / 1000.0));
    }

    @Test
    void rejection_does_not_write() {
        double lastTs = T0.minusSeconds(2).toEpochMilli() / 1000.0;
        store.seed("/usage/7/2026-02-03", Map.of("count", 4, "last_ts", lastTs));

        CooldownDecision d = gate.checkAndUpdate("7");

        assertThat(d.admitted()).isFalse();
        assertThat(d.retryAfterSec()).isEqualTo(3);
        assertThat(store.writes()).isEmpty();
    }

    @Test
    void users_do_not_share_cooldown() {
        assertThat(gate.checkAndUpdate("7").admitted()).isTrue();
        assertThat(gate.checkAndUpdate("8").admitted()).isTrue();
    }

    @Test
    void unavailable_store_always_admits() {
        UsageProperties props = new UsageProperties();
        CooldownGate open = new CooldownGate(new DisabledUsageLedger(10), props, clock);

        assertThat(open.checkAndUpdate("7").admitted()).isTrue();
        assertThat(open.checkAndUpdate("7").admitted()).isTrue();
    }
}
