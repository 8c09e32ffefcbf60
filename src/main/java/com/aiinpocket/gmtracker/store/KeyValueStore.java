package com.aiinpocket.gmtracker.store;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 共享 key-value 儲存的存取介面。
 *
 * <p>所有無狀態的請求處理實例只透過這個介面協調，引擎本身不持有任何行程內共享狀態。
 * key 一律是完整的（已含命名空間前綴）字串。實作遇到連線、逾時等錯誤時
 * 應拋出 {@link KeyValueStoreException}。
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * 條件寫入：僅當 key 目前的值等於 {@code expected} 時才寫入 {@code next}。
     *
     * @param expected 預期的舊值；{@code null} 表示預期 key 不存在
     * @return true 如果寫入成功；false 代表有其他寫入者先改動了這個 key
     */
    boolean compareAndSet(String key, String expected, String next);

    /**
     * 刪除多個 key。
     *
     * @return 實際被刪除的 key 數
     */
    long delete(Collection<String> keys);

    /** 以 glob pattern 掃描符合的 key（完整 key）。 */
    List<String> scanKeys(String pattern);

    void sortedSetIncrementScore(String key, String member, double delta);

    void sortedSetSetScore(String key, String member, double score);

    Optional<Double> sortedSetScore(String key, String member);

    /**
     * 依分數由高到低取出成員。
     *
     * @param limit 筆數；小於 0 表示取出全部
     */
    List<ScoredMember> sortedSetRangeDescending(String key, long offset, long limit);

    void setAdd(String key, String member);
}
