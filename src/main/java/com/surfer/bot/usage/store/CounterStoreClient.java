package com.surfer.bot.usage.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Path-addressed document store（Firebase Realtime Database REST 風格）。
 * <p>
 * 只有獨立的 GET / PUT，沒有 compare-and-swap、沒有多 key transaction、沒有 TTL。
 * 上層所有 read-modify-write 都不是原子的，併發時可能 lost update。
 * <p>
 * 實作不得往外丟例外：
 * <ul>
 *   <li>read：non-2xx、I/O 錯誤、JSON 壞掉、值為 null 都回 {@link Optional#empty()}</li>
 *   <li>write：任何失敗都回 {@code false}（只記 log，不 retry）</li>
 * </ul>
 */
public interface CounterStoreClient {

    Optional<JsonNode> read(String path);

    boolean write(String path, Object value);
}
