package com.aiinpocket.gmtracker.controller;

import com.aiinpocket.gmtracker.service.LeaderboardAggregator;
import com.aiinpocket.gmtracker.service.MissionProgressTracker;
import com.aiinpocket.gmtracker.service.MissionUpdateContentionException;
import com.aiinpocket.gmtracker.service.StreakTracker;
import com.aiinpocket.gmtracker.store.KeyValueStoreException;
import com.aiinpocket.gmtracker.support.GamificationFixture;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.aiinpocket.gmtracker.support.GamificationFixture.ALICE;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GamificationControllerTest {

    private final GamificationFixture fx = new GamificationFixture();

    private MockMvc mvc(StreakTracker streak, MissionProgressTracker missions, LeaderboardAggregator boards) {
        return MockMvcBuilders.standaloneSetup(new GamificationController(streak, missions, boards))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private MockMvc mvc() {
        return mvc(fx.streakTracker, fx.missionTracker, fx.leaderboards);
    }

    @Test
    void trackActivityReturnsStreak() throws Exception {
        mvc().perform(post("/api/gamification/streak")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"" + ALICE + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.streak.current").value(1))
                .andExpect(jsonPath("$.streak.lastActive").value("2025-01-01"));
    }

    @Test
    void invalidAddressIsRejected() throws Exception {
        mvc().perform(get("/api/gamification/streak").param("address", "0x123"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("請提供有效的錢包地址"));
        mvc().perform(get("/api/gamification/missions"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void applyTaskReturnsUpdatedDay() throws Exception {
        mvc().perform(post("/api/gamification/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"" + ALICE + "\",\"taskId\":\"s1_buy5_elements\",\"count\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.day.date").value("2025-01-01"))
                .andExpect(jsonPath("$.day.s1.buyElementsCount").value(3))
                .andExpect(jsonPath("$.day.s1.buy5").value(false))
                .andExpect(jsonPath("$.day.pts").value(0));
    }

    @Test
    void unknownTaskIsBadRequest() throws Exception {
        mvc().perform(post("/api/gamification/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"" + ALICE + "\",\"taskId\":\"s9_fly\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid taskId: s9_fly"));
    }

    @Test
    void invalidDayIsBadRequest() throws Exception {
        mvc().perform(get("/api/gamification/missions").param("address", ALICE).param("day", "2025-13-40"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void contentionMapsToConflict() throws Exception {
        MissionProgressTracker missions = mock(MissionProgressTracker.class);
        when(missions.applyTask(anyString(), anyString(), any(), any()))
                .thenThrow(new MissionUpdateContentionException("gm:missions:x", 5));

        mvc(fx.streakTracker, missions, fx.leaderboards).perform(post("/api/gamification/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"" + ALICE + "\",\"taskId\":\"s1_buy_shield\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("任務進度更新忙碌中，請稍後重試"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mvc().perform(post("/api/gamification/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("請求格式不正確，請檢查欄位型別"));
    }

    @Test
    void storeOutageMapsToServiceUnavailable() throws Exception {
        StreakTracker streak = mock(StreakTracker.class);
        when(streak.getStreak(anyString()))
                .thenThrow(new KeyValueStoreException("redis down", new RuntimeException()));

        mvc(streak, fx.missionTracker, fx.leaderboards)
                .perform(get("/api/gamification/streak").param("address", ALICE))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("進度儲存暫時無法使用，請稍後重試"));
    }

    @Test
    void leaderboardsForMonth() throws Exception {
        fx.missionTracker.applyTask(ALICE, "s3_send_quest", null, 1);
        fx.missionTracker.applyTask(ALICE, "s3_place_order", null, 1);
        fx.missionTracker.applyTask(ALICE, "s3_claim_stake", null, 1);

        mvc().perform(get("/api/gamification/leaderboards").param("month", "202501"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.missionTop[0].address").value(ALICE.toLowerCase()))
                .andExpect(jsonPath("$.missionTop[0].value").value(10));
        mvc().perform(get("/api/gamification/leaderboards").param("month", "2025-01"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missionScoreForMonth() throws Exception {
        fx.missionTracker.applyTask(ALICE, "s3_send_quest", null, 1);
        fx.missionTracker.applyTask(ALICE, "s3_place_order", null, 1);
        fx.missionTracker.applyTask(ALICE, "s3_claim_stake", null, 1);

        mvc().perform(get("/api/gamification/missions/score").param("address", ALICE).param("month", "202501"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(10));
    }
}
