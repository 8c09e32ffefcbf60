package com.aiinpocket.gmtracker.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * 任務完成的證明（交易雜湊或其他中繼資料），僅供稽核，不影響任務狀態。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProofRecord(
        String txHash,
        Map<String, Object> meta
) {
    /** 至少帶有交易雜湊或非空的 meta 才值得保存 */
    public boolean hasContent() {
        return (txHash != null && !txHash.isBlank()) || (meta != null && !meta.isEmpty());
    }
}
