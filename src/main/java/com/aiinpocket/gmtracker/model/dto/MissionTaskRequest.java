package com.aiinpocket.gmtracker.model.dto;

public record MissionTaskRequest(
        String address,
        String taskId,
        ProofRecord proof,
        Integer count
) {}
