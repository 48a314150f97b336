package com.surfer.bot.usage.ledger;

/**
 * 使用量帳本：每日 per-user 計數、最後請求時間、全站每月總量、per-user 每日上限 override。
 * <p>
 * 所有計數更新都是「讀 -> +1 -> 寫」三段式，後端沒有原子遞增，
 * 同一 key 的併發更新可能互相覆蓋（lost update），計數只保證 best-effort。
 * 換成支援原子遞增 / 版本號 CAS 的後端時，只需要換掉實作，呼叫端合約不變。
 * <p>
 * 任何實作都不得因為 store 壞掉而阻擋呼叫端：讀不到就回預設值。
 */
public interface UsageLedger {

    /**
     * 今天的 {count, last_ts}；文件不存在或讀取失敗時回 {@link DailyUsage#ZERO}。
     */
    DailyUsage getUsage(String userId);

    /**
     * 無條件覆寫今天的整份 DailyUsage 文件。
     *
     * @return 寫入是否成功
     */
    boolean setUsage(String userId, int count, double lastTs);

    /**
     * 成功生成一次之後呼叫。依序執行、互相獨立、不回滾：
     * <ol>
     *   <li>讀今天 count，寫回 count+1</li>
     *   <li>寫今天 last_ts = now</li>
     *   <li>讀本月 total_count，寫回 total+1</li>
     * </ol>
     * 中途失敗會留下部分更新，不偵測也不修復。
     *
     * @return 三個寫入是否全部成功
     */
    boolean incrementUsage(String userId);

    /**
     * per-user override（正整數）存在就用它，否則用預設上限。
     */
    int getDailyLimit(String userId);

    /**
     * 寫入 per-user 每日上限 override。
     *
     * @throws IllegalArgumentException limit 不是正整數
     */
    boolean setDailyLimit(String userId, int limit);

    /**
     * 本月全站總量，讀不到回 0。
     */
    long getMonthlyTotal();

    /**
     * 今天的 DailyUsage 覆寫成 {0, 0.0}。
     */
    boolean resetUserDaily(String userId);

    /**
     * 本月全站總量覆寫成 0。
     */
    boolean resetMonthlyTotal();

    /**
     * false = store 未設定，所有操作都只回預設值。
     */
    boolean isAvailable();
}
