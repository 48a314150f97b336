package com.surfer.bot.imagegen;

/**
 * @param size     "512" / "768" / "1024"，null = 1024
 * @param seed     null = provider 自選
 * @param negative 不想出現在圖裡的內容
 */
public record ImageRequest(String prompt, String size, Integer seed, String negative) {

    public static ImageRequest of(String prompt) {
        return new ImageRequest(prompt, null, null, null);
    }
}
