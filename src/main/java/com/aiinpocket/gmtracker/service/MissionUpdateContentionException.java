package com.aiinpocket.gmtracker.service;

/**
 * 任務進度的 compare-and-set 在重試上限內都輸給其他寫入者。
 * 呼叫端應整個操作重試。
 */
public class MissionUpdateContentionException extends RuntimeException {

    private final int attempts;

    public MissionUpdateContentionException(String key, int attempts) {
        super("Mission update contention on " + key + " after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
