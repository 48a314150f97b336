package com.surfer.bot.bot.command;

import com.surfer.bot.bot.config.BotProperties;
import com.surfer.bot.bot.telegram.TelegramClient;
import com.surfer.bot.bot.telegram.dto.TelegramUpdate;
import com.surfer.bot.imagegen.ImageArgsParser;
import com.surfer.bot.imagegen.ImageGenerationClient;
import com.surfer.bot.imagegen.ImageRequest;
import com.surfer.bot.usage.model.AdmissionResult;
import com.surfer.bot.usage.model.QuotaSnapshot;
import com.surfer.bot.usage.service.UsageAdminService;
import com.surfer.bot.usage.service.UsageAdmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CommandDispatcher {

    static final String HELP_TEXT = """
            ✨ Surfer Bot - Help ✨

            • /image <prompt> [--size 512|768|1024 --seed <n> --no <neg>] - generate an image.
            • /quota - your daily usage.
            • /checkquota [user_id] - check usage (other users: admin only).
            • /resetquota <user_id> - admin only.
            • /setlimit <user_id> <n> - admin only.
            • /resetmonth - admin only.
            • /stats - admin only.""";

    static final String IMAGE_USAGE = "Usage: /image <prompt> [--size 512|768|1024] [--seed <n>] [--no <negative>]";
    static final String ADMIN_ONLY = "⛔ Admin only.";
    static final String STORE_UNAVAILABLE = "⚠️ Usage store is not available; nothing was changed.";

    private final TelegramClient telegram;
    private final UsageAdmissionService admission;
    private final UsageAdminService admin;
    private final ImageGenerationClient imageClient;
    private final BotProperties botProps;

    public void handle(TelegramUpdate update) {
        if (update == null || update.message() == null) return;
        TelegramUpdate.TelegramMessage msg = update.message();
        if (msg.text() == null || msg.from() == null || msg.from().id() == null
            || msg.chat() == null || msg.chat().id() == null) {
            return;
        }

        Optional<ParsedCommand> parsed = ParsedCommand.parse(msg.text());
        if (parsed.isEmpty()) return;

        ParsedCommand cmd = parsed.get();
        String userId = String.valueOf(msg.from().id());
        long chatId = msg.chat().id();

        switch (cmd.name()) {
            case "start", "help" -> telegram.sendMessage(chatId, HELP_TEXT);
            case "image" -> image(userId, chatId, cmd);
            case "quota" -> quota(userId, chatId);
            case "checkquota" -> checkQuota(userId, chatId, cmd);
            case "resetquota" -> resetQuota(userId, chatId, cmd);
            case "setlimit" -> setLimit(userId, chatId, cmd);
            case "resetmonth" -> resetMonth(userId, chatId);
            case "stats" -> stats(userId, chatId);
            default -> log.debug("command_ignored name={} user={}", cmd.name(), userId);
        }
    }

    private void image(String userId, long chatId, ParsedCommand cmd) {
        ImageRequest req = ImageArgsParser.parse(cmd.args());
        if (req.prompt().isBlank()) {
            telegram.sendMessage(chatId, IMAGE_USAGE);
            return;
        }

        AdmissionResult<byte[]> r = admission.admitAndRecord(userId, () -> imageClient.generate(req));

        switch (r.outcome()) {
            case ADMITTED -> telegram.sendPhoto(chatId, r.payload(), shorten(req.prompt(), 200));
            case COOLDOWN_REJECTED -> telegram.sendMessage(chatId,
                    "⏳ Please wait " + r.retryAfterSec() + "s before your next request.");
            case QUOTA_EXCEEDED -> telegram.sendMessage(chatId, quotaExceededText(r.quota()));
            case GENERATION_FAILED -> telegram.sendMessage(chatId,
                    "❌ Image generation failed. Your quota was not used.");
        }
    }

    private void quota(String userId, long chatId) {
        QuotaSnapshot q = admission.quotaSnapshot(userId);
        telegram.sendMessage(chatId, "📊 Today: " + q.dailyCount() + "/" + q.dailyLimit() + " images used.");
    }

    private void checkQuota(String userId, long chatId, ParsedCommand cmd) {
        List<String> t = cmd.tokens();
        String target = t.isEmpty() ? userId : t.get(0);
        if (!target.equals(userId) && !botProps.isAdmin(userId)) {
            telegram.sendMessage(chatId, ADMIN_ONLY);
            return;
        }
        QuotaSnapshot q = admission.quotaSnapshot(target);
        telegram.sendMessage(chatId, "📊 User " + target + ": " + q.dailyCount() + "/" + q.dailyLimit()
                                     + " today. Monthly: " + q.monthlyTotal() + "/" + q.monthlyCap() + ".");
    }

    private void resetQuota(String userId, long chatId, ParsedCommand cmd) {
        if (!requireAdmin(userId, chatId)) return;
        List<String> t = cmd.tokens();
        if (t.isEmpty()) {
            telegram.sendMessage(chatId, "Usage: /resetquota <user_id>");
            return;
        }
        String target = t.get(0);
        boolean ok = admin.resetUserDaily(userId, target);
        telegram.sendMessage(chatId, ok ? "✅ Daily usage reset for " + target + "." : STORE_UNAVAILABLE);
    }

    private void setLimit(String userId, long chatId, ParsedCommand cmd) {
        if (!requireAdmin(userId, chatId)) return;
        List<String> t = cmd.tokens();
        if (t.size() < 2) {
            telegram.sendMessage(chatId, "Usage: /setlimit <user_id> <n>");
            return;
        }
        String target = t.get(0);
        int limit;
        try {
            limit = Integer.parseInt(t.get(1));
            boolean ok = admin.setDailyLimit(userId, target, limit);
            telegram.sendMessage(chatId, ok ? "✅ Daily limit for " + target + " set to " + limit + "." : STORE_UNAVAILABLE);
        } catch (IllegalArgumentException e) {
            // NumberFormatException 也是 IllegalArgumentException
            telegram.sendMessage(chatId, "Limit must be a positive integer.");
        }
    }

    private void resetMonth(String userId, long chatId) {
        if (!requireAdmin(userId, chatId)) return;
        boolean ok = admin.resetMonthlyTotal(userId);
        telegram.sendMessage(chatId, ok ? "✅ Monthly total reset." : STORE_UNAVAILABLE);
    }

    private void stats(String userId, long chatId) {
        if (!requireAdmin(userId, chatId)) return;
        QuotaSnapshot q = admission.quotaSnapshot(userId);
        String store = admin.storeAvailable() ? "connected" : "unavailable (fail-open)";
        telegram.sendMessage(chatId, "📈 Monthly images: " + q.monthlyTotal() + "/" + q.monthlyCap()
                                     + "\nStore: " + store);
    }

    private boolean requireAdmin(String userId, long chatId) {
        if (botProps.isAdmin(userId)) return true;
        log.info("admin_command_denied user={}", userId);
        telegram.sendMessage(chatId, ADMIN_ONLY);
        return false;
    }

    static String quotaExceededText(QuotaSnapshot q) {
        if (q != null && q.monthlyExhausted()) {
            return "🚫 The monthly image budget (" + q.monthlyCap() + ") is used up. Please try again next month.";
        }
        if (q == null) return "🚫 Daily limit reached. Please try again tomorrow.";
        return "🚫 Daily limit reached (" + q.dailyCount() + "/" + q.dailyLimit() + "). Please try again tomorrow.";
    }

    private static String shorten(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max) + "...";
    }
}
