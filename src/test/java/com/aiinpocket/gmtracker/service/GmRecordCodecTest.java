package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.model.dto.MissionDay;
import com.aiinpocket.gmtracker.model.dto.StreakRecord;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import static org.junit.jupiter.api.Assertions.*;

class GmRecordCodecTest {

    private final GmRecordCodec codec = new GmRecordCodec(JsonMapper.builder().build());

    @Test
    void missionDayWireFormatUsesSectionKeys() {
        MissionDay day = MissionDay.initial("2025-01-01");
        day.getS1().recordElementPurchases(2);
        String json = codec.write(day);

        assertTrue(json.contains("\"s1\""));
        assertTrue(json.contains("\"buyElementsCount\":2"));
        assertTrue(json.contains("\"buy5\":false"));
        assertFalse(json.contains("completedAt"));
        assertFalse(json.contains("subtasksComplete"));
    }

    @Test
    void unknownFieldsAndMissingSectionsAreTolerated() {
        MissionDay day = codec.readMissionDay(
                "{\"date\":\"2025-01-01\",\"s2\":{\"chatMessage\":true,\"legacy\":1},\"extra\":\"x\"}", "2025-01-01");

        assertTrue(day.getS2().isChatMessage());
        assertNotNull(day.getS1());
        assertNotNull(day.getS4());
    }

    @Test
    void pointsAreRecomputedFromDoneFlags() {
        MissionDay day = codec.readMissionDay(
                "{\"date\":\"2025-01-01\",\"s3\":{\"done\":true},\"pts\":75}", "2025-01-01");
        assertEquals(10, day.getPts());
    }

    @Test
    void nullFlagAndNullCounterKeepOtherProgress() {
        MissionDay day = codec.readMissionDay("{\"date\":\"2025-01-01\","
                + "\"s1\":{\"buyElementsCount\":null,\"buyShield\":true},"
                + "\"s3\":{\"sendQuest\":true,\"placeOrder\":true,\"claimStake\":null,\"done\":true},"
                + "\"pts\":null,\"completedAt\":null}", "2025-01-01");

        assertEquals(0, day.getS1().getBuyElementsCount());
        assertTrue(day.getS1().isBuyShield());
        assertFalse(day.getS3().isClaimStake());
        assertTrue(day.getS3().isDone());
        assertEquals(10, day.getPts());
        assertNull(day.getCompletedAt());
    }

    @Test
    void nullStreakCounterReadsAsZero() {
        StreakRecord s = codec.readStreak(
                "{\"current\":null,\"best\":9,\"lastActive\":\"2025-01-01\"}", "0xabc").orElseThrow();
        assertEquals(0, s.current());
        assertEquals(9, s.best());
    }

    @Test
    void malformedJsonFallsBackToInitialDay() {
        MissionDay day = codec.readMissionDay("[1,2", "2025-02-02");
        assertEquals("2025-02-02", day.getDate());
        assertEquals(0, day.getPts());
    }

    @Test
    void streakIsNormalizedForKeyAddress() {
        StreakRecord s = codec.readStreak("{\"current\":-2,\"best\":1}", "0xabc").orElseThrow();
        assertEquals("0xabc", s.address());
        assertEquals(0, s.current());
        assertEquals(1, s.best());
        assertEquals("", s.lastActive());
    }

    @Test
    void absentStreakIsEmptyOptional() {
        assertTrue(codec.readStreak(null, "0xabc").isEmpty());
        assertTrue(codec.readStreak("not-json", "0xabc").isEmpty());
    }
}
