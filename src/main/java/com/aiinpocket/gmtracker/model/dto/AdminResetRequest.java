package com.aiinpocket.gmtracker.model.dto;

public record AdminResetRequest(String scope) {}
