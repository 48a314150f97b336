package com.surfer.bot.bot.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 啟動完成後把指令清單註冊到 Telegram（輸入 / 時的提示選單）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BotCommandRegistrar {

    static final Map<String, String> COMMANDS = new LinkedHashMap<>();

    static {
        COMMANDS.put("help", "Show help");
        COMMANDS.put("image", "Generate AI image");
        COMMANDS.put("quota", "Show usage");
    }

    private final TelegramClient telegram;
    private final TelegramProperties props;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.isRegisterCommands() || !props.hasToken()) {
            log.info("telegram_commands_skip register={} hasToken={}", props.isRegisterCommands(), props.hasToken());
            return;
        }
        boolean ok = telegram.setMyCommands(COMMANDS);
        log.info("telegram_commands_registered ok={} count={}", ok, COMMANDS.size());
    }
}
