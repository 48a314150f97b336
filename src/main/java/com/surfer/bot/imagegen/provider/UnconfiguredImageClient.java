package com.surfer.bot.imagegen.provider;

import com.surfer.bot.imagegen.ImageGenerationClient;
import com.surfer.bot.imagegen.ImageGenerationException;
import com.surfer.bot.imagegen.ImageRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Vertex 未啟用時的替身：每次都失敗，所以不會扣到任何配額。
 */
@Slf4j
public class UnconfiguredImageClient implements ImageGenerationClient {

    @Override
    public byte[] generate(ImageRequest request) {
        log.error("image_provider_not_configured");
        throw new ImageGenerationException("IMAGE_PROVIDER_NOT_CONFIGURED");
    }
}
