package com.aiinpocket.gmtracker.model.event;

/**
 * 地址當日四個任務區塊全部完成（滿 80 分）。
 * 每個地址每天只會發布一次（由冪等標記保證），供下游獎勵發放使用。
 */
public record MissionDayCompleted(String address, String day, long completedAt) {}
