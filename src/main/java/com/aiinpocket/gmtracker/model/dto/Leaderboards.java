package com.aiinpocket.gmtracker.model.dto;

import java.util.List;

/**
 * 排行榜查詢結果。
 *
 * @param month     查詢的月份（yyyyMM）；總榜為 null
 * @param streakTop 連續活躍榜
 * @param missionTop 任務積分榜
 */
public record Leaderboards(
        String month,
        List<LeaderboardEntry> streakTop,
        List<LeaderboardEntry> missionTop
) {}
