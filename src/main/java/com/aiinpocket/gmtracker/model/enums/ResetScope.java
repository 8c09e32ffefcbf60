package com.aiinpocket.gmtracker.model.enums;

import lombok.Getter;

import java.util.List;

/**
 * 管理重置的範圍，以及各範圍展開後的 key pattern（相對於命名空間前綴）。
 * pattern 之間可能重疊，刪除前會先去重。
 */
@Getter
public enum ResetScope {

    STREAKS("streaks", List.of("streak:*", "streak:leaderboard:*", "streak:activity:*")),
    MISSIONS("missions", List.of("missions:*", "missions:leaderboard:*", "missions:proof:*")),
    ALL("all", List.of("streak:*", "streak:leaderboard:*", "streak:activity:*",
            "missions:*", "missions:leaderboard:*", "missions:proof:*"));

    private final String value;
    private final List<String> patterns;

    ResetScope(String value, List<String> patterns) {
        this.value = value;
        this.patterns = patterns;
    }

    /**
     * @throws IllegalArgumentException 缺少或未知的範圍
     */
    public static ResetScope fromValue(String value) {
        if (value != null) {
            for (ResetScope scope : values()) {
                if (scope.value.equalsIgnoreCase(value.trim())) return scope;
            }
        }
        throw new IllegalArgumentException("Invalid scope: " + value);
    }
}
