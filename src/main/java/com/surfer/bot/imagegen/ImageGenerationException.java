package com.surfer.bot.imagegen;

import lombok.Getter;

/**
 * message = 錯誤碼（例如 IMAGE_PROVIDER_HTTP_429），上層直接拿來當 failureCode。
 */
@Getter
public class ImageGenerationException extends RuntimeException {

    private final Integer status;

    public ImageGenerationException(String code) {
        this(code, null, null);
    }

    public ImageGenerationException(String code, Integer status, Throwable cause) {
        super(code, cause);
        this.status = status;
    }
}
