package com.aiinpocket.gmtracker.model.dto;

public record LeaderboardEntry(String address, long value) {}
