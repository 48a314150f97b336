package com.surfer.bot.bot.command;

import com.surfer.bot.bot.config.BotProperties;
import com.surfer.bot.bot.telegram.TelegramClient;
import com.surfer.bot.bot.telegram.dto.TelegramUpdate;
import com.surfer.bot.imagegen.ImageGenerationClient;
import com.surfer.bot.imagegen.ImageRequest;
import com.surfer.bot.usage.model.AdmissionResult;
import com.surfer.bot.usage.model.QuotaSnapshot;
import com.surfer.bot.usage.service.UsageAdminService;
import com.surfer.bot.usage.service.UsageAdmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;
import java.util.concurrent.Callable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    private static final long CHAT = 1000L;
    private static final String ADMIN = "42";
    private static final String USER = "7";

    @Mock TelegramClient telegram;
    @Mock UsageAdmissionService admission;
    @Mock UsageAdminService admin;
    @Mock ImageGenerationClient imageClient;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        BotProperties props = new BotProperties();
        props.setAdminIds(Set.of(ADMIN));
        dispatcher = new CommandDispatcher(telegram, admission, admin, imageClient, props);
    }

    private static TelegramUpdate update(String fromId, String text) {
        return new TelegramUpdate(1L, new TelegramUpdate.TelegramMessage(
                10L,
                new TelegramUpdate.TelegramUser(Long.parseLong(fromId), "u" + fromId, "U"),
                new TelegramUpdate.TelegramChat(CHAT, "private"),
                text
        ));
    }

    @Test
    @SuppressWarnings("unchecked")
    void image_admitted_sends_photo_generated_from_parsed_request() throws Exception {
        byte[] png = {1, 2, 3};
        when(admission.<byte[]>admitAndRecord(eq(USER), any()))
                .thenReturn(AdmissionResult.admitted(png, new QuotaSnapshot(1, 10, 5, 100)));

        dispatcher.handle(update(USER, "/image a wave --size 512"));

        ArgumentCaptor<Callable<byte[]>> gen = ArgumentCaptor.forClass(Callable.class);
        verify(admission).admitAndRecord(eq(USER), gen.capture());
        verify(telegram).sendPhoto(CHAT, png, "a wave");

        // 傳進 admission 的生成動作就是呼叫 provider
        when(imageClient.generate(any())).thenReturn(png);
        gen.getValue().call();
        verify(imageClient).generate(new ImageRequest("a wave", "512", null, null));
    }

    @Test
    void image_cooldown_reports_wait_time() {
        when(admission.<byte[]>admitAndRecord(eq(USER), any()))
                .thenReturn(AdmissionResult.cooldownRejected(4));

        dispatcher.handle(update(USER, "/image a wave"));

        verify(telegram).sendMessage(CHAT, "⏳ Please wait 4s before your next request.");
        verify(telegram, never()).sendPhoto(anyLong(), any(), any());
    }

    @Test
    void image_quota_exceeded_reports_daily_limit() {
        when(admission.<byte[]>admitAndRecord(eq(USER), any()))
                .thenReturn(AdmissionResult.quotaExceeded(new QuotaSnapshot(10, 10, 50, 100)));

        dispatcher.handle(update(USER, "/image a wave"));

        verify(telegram).sendMessage(eq(CHAT), contains("Daily limit reached (10/10)"));
    }

    @Test
    void image_generation_failure_says_quota_not_used() {
        when(admission.<byte[]>admitAndRecord(eq(USER), any()))
                .thenReturn(AdmissionResult.generationFailed("IMAGE_PROVIDER_HTTP_500"));

        dispatcher.handle(update(USER, "/image a wave"));

        verify(telegram).sendMessage(eq(CHAT), contains("quota was not used"));
    }

    @Test
    void image_without_prompt_shows_usage_and_skips_admission() {
        dispatcher.handle(update(USER, "/image --seed 3"));

        verify(telegram).sendMessage(CHAT, CommandDispatcher.IMAGE_USAGE);
        verifyNoInteractions(admission);
    }

    @Test
    void quota_reports_callers_usage() {
        when(admission.quotaSnapshot(USER)).thenReturn(new QuotaSnapshot(3, 10, 50, 100));

        dispatcher.handle(update(USER, "/quota"));

        verify(telegram).sendMessage(CHAT, "📊 Today: 3/10 images used.");
    }

    @Test
    void non_admin_cannot_run_admin_commands() {
        dispatcher.handle(update(USER, "/resetquota 99"));
        dispatcher.handle(update(USER, "/setlimit 99 5"));
        dispatcher.handle(update(USER, "/resetmonth"));
        dispatcher.handle(update(USER, "/stats"));

        verify(telegram, times(4)).sendMessage(CHAT, CommandDispatcher.ADMIN_ONLY);
        verifyNoInteractions(admin);
    }

    @Test
    void non_admin_cannot_check_other_users() {
        dispatcher.handle(update(USER, "/checkquota 99"));

        verify(telegram).sendMessage(CHAT, CommandDispatcher.ADMIN_ONLY);
        verify(admission, never()).quotaSnapshot(anyString());
    }

    @Test
    void admin_checks_any_user() {
        when(admission.quotaSnapshot("99")).thenReturn(new QuotaSnapshot(2, 5, 50, 100));

        dispatcher.handle(update(ADMIN, "/checkquota 99"));

        verify(telegram).sendMessage(CHAT, "📊 User 99: 2/5 today. Monthly: 50/100.");
    }

    @Test
    void admin_reset_quota() {
        when(admin.resetUserDaily(ADMIN, "99")).thenReturn(true);

        dispatcher.handle(update(ADMIN, "/resetquota 99"));

        verify(telegram).sendMessage(CHAT, "✅ Daily usage reset for 99.");
    }

    @Test
    void admin_set_limit() {
        when(admin.setDailyLimit(ADMIN, "99", 25)).thenReturn(true);

        dispatcher.handle(update(ADMIN, "/setlimit 99 25"));

        verify(telegram).sendMessage(CHAT, "✅ Daily limit for 99 set to 25.");
    }

    @Test
    void admin_set_limit_rejects_bad_numbers() {
        dispatcher.handle(update(ADMIN, "/setlimit 99 many"));

        verify(telegram).sendMessage(CHAT, "Limit must be a positive integer.");
        verifyNoInteractions(admin);
    }

    @Test
    void admin_reset_month_with_unavailable_store() {
        when(admin.resetMonthlyTotal(ADMIN)).thenReturn(false);

        dispatcher.handle(update(ADMIN, "/resetmonth"));

        verify(telegram).sendMessage(CHAT, CommandDispatcher.STORE_UNAVAILABLE);
    }

    @Test
    void unknown_commands_and_plain_text_are_ignored() {
        dispatcher.handle(update(USER, "/ask what is love"));
        dispatcher.handle(update(USER, "hello"));
        dispatcher.handle(new TelegramUpdate(2L, null));

        verifyNoInteractions(telegram, admission, admin);
    }

    @Test
    void quota_exceeded_text_prefers_monthly_message() {
        assertThat(CommandDispatcher.quotaExceededText(new QuotaSnapshot(1, 10, 100, 100)))
                .contains("monthly image budget (100)");
    }
}
