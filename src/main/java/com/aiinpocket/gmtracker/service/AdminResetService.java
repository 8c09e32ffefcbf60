package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.config.CacheConfig;
import com.aiinpocket.gmtracker.config.GamificationProperties;
import com.aiinpocket.gmtracker.model.dto.ResetAudit;
import com.aiinpocket.gmtracker.model.dto.ResetResult;
import com.aiinpocket.gmtracker.model.enums.ResetScope;
import com.aiinpocket.gmtracker.store.KeyValueStore;
import com.aiinpocket.gmtracker.store.KeyValueStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 管理重置：依範圍批次刪除遊戲化資料。破壞性且不可逆，只能由已驗證的管理端點呼叫。
 *
 * <p>與使用者寫入不互斥：重置掃描與刪除期間若有進行中的任務寫入，紀錄可能在重置後立即重新出現。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminResetService {

    private final KeyValueStore store;
    private final GmKeys keys;
    private final GmRecordCodec codec;
    private final GamificationProperties props;
    private final Clock clock;

    /**
     * 先收集範圍內所有 pattern 掃到的 key 並去重，再分批刪除。
     * 某批刪除失敗時改為逐一刪除，單一壞 key 不會擋住其他 key。
     *
     * @return 實際刪除的不重複 key 數
     */
    @CacheEvict(cacheNames = CacheConfig.COMBINED_LEADERBOARDS, allEntries = true)
    public ResetResult adminReset(ResetScope scope) {
        Objects.requireNonNull(scope, "scope");

        Set<String> matched = new LinkedHashSet<>();
        for (String pattern : scope.getPatterns()) {
            List<String> found = store.scanKeys(keys.pattern(pattern));
            log.info("[管理重置] pattern {} 找到 {} 個 key", pattern, found.size());
            matched.addAll(found);
        }

        List<String> all = new ArrayList<>(matched);
        long deleted = 0;
        int batchSize = props.resetBatchSize();
        for (int i = 0; i < all.size(); i += batchSize) {
            List<String> batch = all.subList(i, Math.min(i + batchSize, all.size()));
            deleted += deleteBatch(batch);
        }

        long at = clock.millis();
        try {
            store.set(keys.adminLastReset(), codec.write(new ResetAudit(scope.getValue(), at, deleted)));
        } catch (KeyValueStoreException e) {
            log.warn("[管理重置] 稽核紀錄寫入失敗: {}", e.getMessage());
        }
        log.info("[管理重置] 範圍 {} 完成：{} 個 key 符合，刪除 {} 個", scope.getValue(), matched.size(), deleted);
        return new ResetResult(scope, deleted);
    }

    private long deleteBatch(List<String> batch) {
        try {
            return store.delete(batch);
        } catch (KeyValueStoreException e) {
            log.warn("[管理重置] 批次刪除 {} 個 key 失敗，改為逐一刪除: {}", batch.size(), e.getMessage());
        }
        long deleted = 0;
        for (String key : batch) {
            try {
                deleted += store.delete(List.of(key));
            } catch (KeyValueStoreException e) {
                log.error("[管理重置] 刪除 {} 失敗: {}", key, e.getMessage());
            }
        }
        return deleted;
    }
}
