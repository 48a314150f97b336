package com.surfer.bot.testsupport;

import org.springframework.test.context.ActiveProfiles;

/**
 * ✅ 給所有 Spring 測試共用的基底類別
 * - 強制使用 test profile（store / telegram / vertex 全部未設定）
 */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
