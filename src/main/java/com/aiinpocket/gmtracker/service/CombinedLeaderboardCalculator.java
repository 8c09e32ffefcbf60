package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.config.CacheConfig;
import com.aiinpocket.gmtracker.config.GamificationProperties;
import com.aiinpocket.gmtracker.model.dto.LeaderboardEntry;
import com.aiinpocket.gmtracker.model.dto.StreakRecord;
import com.aiinpocket.gmtracker.store.KeyValueStore;
import com.aiinpocket.gmtracker.store.KeyValueStoreException;
import com.aiinpocket.gmtracker.store.ScoredMember;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 總榜計算。
 *
 * <p>兩種訊號的性質不同，彙總方式也不同：
 * <ul>
 *   <li>任務積分可跨月累加（終身總努力），把每個月份榜的分數按地址加總</li>
 *   <li>連續活躍是地址本身的屬性，各月份的連續紀錄彼此無關，直接取每筆 StreakRecord 的 best</li>
 * </ul>
 * 沒有另外維護「總榜」結構，每次讀取時重算；結果以短 TTL 快取。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CombinedLeaderboardCalculator {

    static final Comparator<LeaderboardEntry> RANKING = Comparator
            .comparingLong(LeaderboardEntry::value).reversed()
            .thenComparing(LeaderboardEntry::address);

    private final KeyValueStore store;
    private final GmKeys keys;
    private final GmRecordCodec codec;
    private final GamificationProperties props;

    @Cacheable(cacheNames = CacheConfig.COMBINED_LEADERBOARDS, key = "'missions'")
    public List<LeaderboardEntry> combinedMissionTop() {
        Map<String, Double> totals = new HashMap<>();
        List<String> monthKeys = store.scanKeys(keys.missionsLeaderboardPattern());
        for (String key : monthKeys) {
            try {
                for (ScoredMember m : store.sortedSetRangeDescending(key, 0, -1)) {
                    if (m.member() == null || m.member().isBlank() || !Double.isFinite(m.score())) continue;
                    totals.merge(m.member().toLowerCase(Locale.ROOT), m.score(), Double::sum);
                }
            } catch (KeyValueStoreException e) {
                log.warn("[排行榜] 彙總任務積分榜 {} 失敗，略過: {}", key, e.getMessage());
            }
        }
        log.debug("[排行榜] 任務總榜彙總 {} 個月份、{} 個地址", monthKeys.size(), totals.size());

        return totals.entrySet().stream()
                .map(e -> new LeaderboardEntry(e.getKey(), Math.round(e.getValue())))
                .sorted(RANKING)
                .limit(props.leaderboardSize())
                .toList();
    }

    @Cacheable(cacheNames = CacheConfig.COMBINED_LEADERBOARDS, key = "'streaks'")
    public List<LeaderboardEntry> combinedStreakTop() {
        List<LeaderboardEntry> results = new ArrayList<>();
        for (String key : store.scanKeys(keys.streakPattern())) {
            String address = keys.addressOfStreakKey(key);
            if (address == null) continue;
            try {
                Optional<StreakRecord> record = codec.readStreak(store.get(key).orElse(null), address);
                record.filter(r -> r.best() > 0)
                        .ifPresent(r -> results.add(new LeaderboardEntry(address, r.best())));
            } catch (KeyValueStoreException e) {
                log.warn("[排行榜] 讀取連續紀錄 {} 失敗，略過: {}", key, e.getMessage());
            }
        }

        return results.stream()
                .sorted(RANKING)
                .limit(props.leaderboardSize())
                .toList();
    }
}
