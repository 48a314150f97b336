package com.surfer.bot.usage.service;

import com.surfer.bot.usage.ledger.UsageLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UsageAdminServiceTest {

    @Mock UsageLedger ledger;
    @InjectMocks UsageAdminService admin;

    @Test
    void reset_daily_targets_the_given_user() {
        when(ledger.resetUserDaily("99")).thenReturn(true);

        assertThat(admin.resetUserDaily("42", "99")).isTrue();
        verify(ledger).resetUserDaily("99");
        verifyNoMoreInteractions(ledger);
    }

    @Test
    void reset_monthly_reports_store_result() {
        when(ledger.resetMonthlyTotal()).thenReturn(false);

        assertThat(admin.resetMonthlyTotal("42")).isFalse();
    }

    @Test
    void set_limit_propagates_validation_error() {
        when(ledger.setDailyLimit("99", 0)).thenThrow(new IllegalArgumentException("DAILY_LIMIT_NOT_POSITIVE"));

        assertThatThrownBy(() -> admin.setDailyLimit("42", "99", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DAILY_LIMIT_NOT_POSITIVE");
    }

    @Test
    void set_limit_writes_override() {
        when(ledger.setDailyLimit("99", 25)).thenReturn(true);

        assertThat(admin.setDailyLimit("42", "99", 25)).isTrue();
    }
}
