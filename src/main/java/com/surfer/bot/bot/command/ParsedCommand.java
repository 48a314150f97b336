package com.surfer.bot.bot.command;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "/name@bot args..." -> (name, args)。name 一律小寫，args 保留原文（只去頭尾空白）。
 */
public record ParsedCommand(String name, String args) {

    private static final Pattern COMMAND = Pattern.compile("^/([A-Za-z0-9_]+)(?:@\\S+)?(?:\\s+(.*))?$", Pattern.DOTALL);

    public static Optional<ParsedCommand> parse(String text) {
        if (text == null) return Optional.empty();
        Matcher m = COMMAND.matcher(text.trim());
        if (!m.matches()) return Optional.empty();

        String args = m.group(2) == null ? "" : m.group(2).trim();
        return Optional.of(new ParsedCommand(m.group(1).toLowerCase(Locale.ROOT), args));
    }

    public List<String> tokens() {
        if (args.isBlank()) return List.of();
        return Arrays.asList(args.trim().split("\\s+"));
    }
}
