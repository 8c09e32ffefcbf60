package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.model.dto.MissionDay;
import com.aiinpocket.gmtracker.model.dto.StreakRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * 持久化紀錄的 JSON 編解碼。
 * 無法解析的舊資料或損壞資料視為不存在（由呼叫端改用預設值），不讓整個請求失敗。
 * 個別欄位為 null 時以型別預設值（false / 0）讀入，其他欄位的進度照常保留。
 */
@Component
@Slf4j
public class GmRecordCodec {

    private final ObjectMapper objectMapper;

    public GmRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.rebuild()
                .disable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
    }

    public String write(Object value) {
        return objectMapper.writeValueAsString(value);
    }

    public <T> Optional<T> read(String raw, Class<T> type) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.ofNullable(objectMapper.readValue(raw, type));
        } catch (JacksonException e) {
            log.warn("[紀錄解析] 無法解析 {}，改用預設值: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * 解析任務紀錄；不存在或損壞時回傳當日的初始紀錄。
     * 區塊為 null、計數為負、pts 與 done 旗標不一致時一併修正。
     */
    public MissionDay readMissionDay(String raw, String day) {
        MissionDay mission = read(raw, MissionDay.class).orElseGet(() -> MissionDay.initial(day));
        if (mission.getDate() == null || mission.getDate().isBlank()) mission.setDate(day);
        if (mission.getS1() == null) mission.setS1(new MissionDay.ShopSection());
        if (mission.getS2() == null) mission.setS2(new MissionDay.SocialSection());
        if (mission.getS3() == null) mission.setS3(new MissionDay.QuestSection());
        if (mission.getS4() == null) mission.setS4(new MissionDay.TradeSection());
        if (mission.getS1().getBuyElementsCount() < 0) mission.getS1().setBuyElementsCount(0);
        mission.setPts(mission.pointsFromDoneSections());
        return mission;
    }

    public Optional<StreakRecord> readStreak(String raw, String address) {
        return read(raw, StreakRecord.class).map(s -> s.normalizedFor(address));
    }
}
