package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.config.GamificationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 遊戲化資料在共享儲存中的 key 佈局。所有 key 都掛在設定的命名空間前綴之下，地址一律小寫。
 */
@Component
public class GmKeys {

    public static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyyMM");

    private static final String STREAK = "streak:";
    private static final String MISSIONS = "missions:";

    private final String prefix;

    public GmKeys(GamificationProperties props) {
        this.prefix = props.keyPrefix();
    }

    public static String normalizeAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public static String month(LocalDate day) {
        return day.format(MONTH);
    }

    public String streak(String address) {
        return prefix + STREAK + address;
    }

    public String streakLeaderboard(String yyyymm) {
        return prefix + STREAK + "leaderboard:" + yyyymm;
    }

    public String streakActivity(LocalDate day) {
        return prefix + STREAK + "activity:" + day;
    }

    public String missions(String address, LocalDate day) {
        return prefix + MISSIONS + address + ":" + day;
    }

    public String missionsLeaderboard(String yyyymm) {
        return prefix + MISSIONS + "leaderboard:" + yyyymm;
    }

    public String proof(String address, LocalDate day, String taskId) {
        return prefix + MISSIONS + "proof:" + address + ":" + day + ":" + taskId;
    }

    public String idempotency(String address, String rewardId) {
        return prefix + "idemp:" + address + ":" + rewardId;
    }

    public String adminLastReset() {
        return prefix + "admin:lastResetAt";
    }

    /** 將相對 pattern（如 streak:*）展開為完整 pattern */
    public String pattern(String relative) {
        return prefix + relative;
    }

    public String streakPattern() {
        return prefix + STREAK + "*";
    }

    public String missionsLeaderboardPattern() {
        return prefix + MISSIONS + "leaderboard:*";
    }

    /**
     * 從 streak key 取出地址；leaderboard、activity 等子命名空間回傳 null。
     */
    public String addressOfStreakKey(String key) {
        String head = prefix + STREAK;
        if (key == null || !key.startsWith(head)) return null;
        String rest = key.substring(head.length());
        if (rest.isEmpty() || rest.contains(":")) return null;
        return rest.toLowerCase(Locale.ROOT);
    }
}
