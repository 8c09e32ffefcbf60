package com.aiinpocket.gmtracker.model.dto;

/**
 * 最近一次管理重置的稽核紀錄（admin:lastResetAt）。
 */
public record ResetAudit(String scope, long at, long deleted) {}
