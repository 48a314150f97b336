package com.surfer.bot.imagegen;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code /image <prompt> [--size 512|768|1024] [--seed n] [--no negative...]}
 * <p>
 * 依序抽出 size、seed、no；--no 吃到行尾，剩下的文字就是 prompt。
 */
public final class ImageArgsParser {

    private static final Pattern SIZE = Pattern.compile("--size\\s+(512|768|1024)");
    private static final Pattern SEED = Pattern.compile("--seed\\s+(\\d+)");
    private static final Pattern NEGATIVE = Pattern.compile("--no\\s+([^\\n]+)");

    private ImageArgsParser() {}

    public static ImageRequest parse(String raw) {
        String text = raw == null ? "" : raw;

        String size = null;
        Matcher m = SIZE.matcher(text);
        if (m.find()) {
            size = m.group(1);
            text = SIZE.matcher(text).replaceAll("");
        }

        Integer seed = null;
        m = SEED.matcher(text);
        if (m.find()) {
            try {
                seed = Integer.parseInt(m.group(1));
            } catch (NumberFormatException ignore) {
                // 超過 int 範圍就當沒給
            }
            text = SEED.matcher(text).replaceAll("");
        }

        String negative = null;
        m = NEGATIVE.matcher(text);
        if (m.find()) {
            negative = m.group(1).trim();
            text = NEGATIVE.matcher(text).replaceAll("");
        }

        String prompt = text.replaceAll("\\s+", " ").trim();
        return new ImageRequest(prompt, size, seed, negative);
    }
}
