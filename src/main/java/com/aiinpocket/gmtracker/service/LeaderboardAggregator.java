package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.config.GamificationProperties;
import com.aiinpocket.gmtracker.model.dto.LeaderboardEntry;
import com.aiinpocket.gmtracker.model.dto.Leaderboards;
import com.aiinpocket.gmtracker.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 排行榜查詢。
 * 指定月份時直接對該月份的排序集合做降冪範圍查詢；未指定或指定 all/combined/lifetime 時回傳總榜。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaderboardAggregator {

    private static final Set<String> COMBINED_ALIASES = Set.of("all", "combined", "lifetime");

    private final KeyValueStore store;
    private final GmKeys keys;
    private final CombinedLeaderboardCalculator combined;
    private final GamificationProperties props;

    public Leaderboards getLeaderboards(String month) {
        if (isCombined(month)) {
            return new Leaderboards(null, combined.combinedStreakTop(), combined.combinedMissionTop());
        }
        String yyyymm = requireMonth(month);
        return new Leaderboards(yyyymm,
                monthlyTop(keys.streakLeaderboard(yyyymm)),
                monthlyTop(keys.missionsLeaderboard(yyyymm)));
    }

    private List<LeaderboardEntry> monthlyTop(String key) {
        return store.sortedSetRangeDescending(key, 0, props.leaderboardSize()).stream()
                .filter(m -> Double.isFinite(m.score()))
                .map(m -> new LeaderboardEntry(m.member(), Math.round(m.score())))
                .toList();
    }

    static boolean isCombined(String month) {
        return month == null || month.isBlank() || COMBINED_ALIASES.contains(month.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @throws IllegalArgumentException 不是 yyyyMM 格式
     */
    static String requireMonth(String month) {
        String m = month == null ? "" : month.trim();
        if (!m.matches("\\d{4}(0[1-9]|1[0-2])")) {
            throw new IllegalArgumentException("Invalid month: " + month);
        }
        return m;
    }
}
