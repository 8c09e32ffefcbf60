package com.aiinpocket.gmtracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 遊戲化引擎設定（prefix = gamification）。
 * 未設定的欄位套用預設值，讓測試可以只覆寫需要的項目。
 *
 * @param keyPrefix           所有 key 的命名空間前綴
 * @param disabled            停用開關：為 true 時所有寫入操作改為唯讀
 * @param maxUpdateAttempts   任務進度 compare-and-set 最大嘗試次數
 * @param counterIncrementCap 單次呼叫計數型子任務的增量上限
 * @param leaderboardSize     排行榜回傳筆數
 * @param resetBatchSize      管理重置每批刪除的 key 數
 * @param scanCount           SCAN 每輪建議筆數
 * @param combinedCacheTtl    總榜快取存活時間
 * @param adminApiKey         管理端點的 Bearer 金鑰（未設定則拒絕所有管理請求）
 */
@ConfigurationProperties(prefix = "gamification")
public record GamificationProperties(
        String keyPrefix,
        boolean disabled,
        int maxUpdateAttempts,
        int counterIncrementCap,
        int leaderboardSize,
        int resetBatchSize,
        int scanCount,
        Duration combinedCacheTtl,
        String adminApiKey
) {
    public GamificationProperties {
        if (keyPrefix == null || keyPrefix.isBlank()) keyPrefix = "gm:";
        if (maxUpdateAttempts <= 0) maxUpdateAttempts = 5;
        if (counterIncrementCap <= 0) counterIncrementCap = 1000;
        if (leaderboardSize <= 0) leaderboardSize = 50;
        if (resetBatchSize <= 0) resetBatchSize = 100;
        if (scanCount <= 0) scanCount = 1000;
        if (combinedCacheTtl == null || combinedCacheTtl.isNegative()) combinedCacheTtl = Duration.ofSeconds(30);
    }

    /** 全部使用預設值的設定 */
    public static GamificationProperties defaults() {
        return new GamificationProperties(null, false, 0, 0, 0, 0, 0, null, null);
    }
}
