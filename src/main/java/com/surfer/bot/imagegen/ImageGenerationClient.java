package com.surfer.bot.imagegen;

public interface ImageGenerationClient {

    /**
     * @return 圖片 bytes（非空）
     * @throws ImageGenerationException 設定缺失、HTTP 失敗、回應沒有圖片
     */
    byte[] generate(ImageRequest request);
}
