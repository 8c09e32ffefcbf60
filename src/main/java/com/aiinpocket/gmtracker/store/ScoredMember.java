package com.aiinpocket.gmtracker.store;

public record ScoredMember(String member, double score) {}
