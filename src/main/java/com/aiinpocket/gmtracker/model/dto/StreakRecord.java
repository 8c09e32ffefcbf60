package com.aiinpocket.gmtracker.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 地址的連續活躍紀錄。
 *
 * @param address    小寫地址
 * @param current    目前連續天數
 * @param best       歷史最長連續天數（恆 ≥ current）
 * @param lastActive 最後活躍日（yyyy-MM-dd，UTC）；從未活躍為空字串
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreakRecord(
        String address,
        int current,
        int best,
        String lastActive
) {
    public static StreakRecord empty(String address) {
        return new StreakRecord(address, 0, 0, "");
    }

    /** 修正負值與 best < current 的損壞資料，並以 key 上的地址為準 */
    public StreakRecord normalizedFor(String address) {
        int c = Math.max(0, current);
        int b = Math.max(Math.max(0, best), c);
        return new StreakRecord(address, c, b, lastActive == null ? "" : lastActive);
    }

    public StreakRecord withCurrent(int value) {
        return new StreakRecord(address, value, Math.max(best, value), lastActive);
    }
}
