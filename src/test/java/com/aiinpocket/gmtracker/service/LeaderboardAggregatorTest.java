package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.model.dto.LeaderboardEntry;
import com.aiinpocket.gmtracker.model.dto.Leaderboards;
import com.aiinpocket.gmtracker.model.enums.MissionTask;
import com.aiinpocket.gmtracker.support.GamificationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.aiinpocket.gmtracker.support.GamificationFixture.ALICE;
import static com.aiinpocket.gmtracker.support.GamificationFixture.BOB;
import static com.aiinpocket.gmtracker.support.GamificationFixture.CAROL;
import static org.junit.jupiter.api.Assertions.*;

class LeaderboardAggregatorTest {

    private static final String ALICE_LOWER = ALICE.toLowerCase();

    private GamificationFixture fx;

    @BeforeEach
    void setUp() {
        fx = new GamificationFixture();
    }

    private void completeS1(String address) {
        fx.missionTracker.applyTask(address, MissionTask.S1_BUY5_ELEMENTS, null, 5);
        fx.missionTracker.applyTask(address, MissionTask.S1_BUY_SHIELD, null, 1);
        fx.missionTracker.applyTask(address, MissionTask.S1_CLAIM_PRODUCTION, null, 1);
    }

    private void completeS2(String address) {
        fx.missionTracker.applyTask(address, MissionTask.S2_APPLY_RESOURCES, null, 1);
        fx.missionTracker.applyTask(address, MissionTask.S2_ATTACK_PLANT, null, 1);
        fx.missionTracker.applyTask(address, MissionTask.S2_CHAT_MESSAGE, null, 1);
    }

    @Test
    void pointsFromTwoDaysOfOneMonthAddUp() {
        fx.clock.set(Instant.parse("2025-03-01T08:00:00Z"));
        completeS1(ALICE);
        fx.clock.set(Instant.parse("2025-03-05T08:00:00Z"));
        completeS2(ALICE);

        Leaderboards monthly = fx.leaderboards.getLeaderboards("202503");
        assertEquals("202503", monthly.month());
        assertEquals(List.of(new LeaderboardEntry(ALICE_LOWER, 40)), monthly.missionTop());

        Leaderboards combined = fx.leaderboards.getLeaderboards(null);
        assertNull(combined.month());
        assertEquals(List.of(new LeaderboardEntry(ALICE_LOWER, 40)), combined.missionTop());
    }

    @Test
    void combinedMissionRankingSumsAcrossMonths() {
        fx.clock.set(Instant.parse("2025-01-10T08:00:00Z"));
        completeS1(ALICE);
        completeS1(BOB);
        completeS2(BOB);
        fx.clock.set(Instant.parse("2025-02-10T08:00:00Z"));
        completeS1(ALICE);
        completeS2(ALICE);

        List<LeaderboardEntry> top = fx.leaderboards.getLeaderboards("all").missionTop();

        assertEquals(2, top.size());
        assertEquals(new LeaderboardEntry(ALICE_LOWER, 60), top.get(0));
        assertEquals(new LeaderboardEntry(BOB.toLowerCase(), 40), top.get(1));
        assertEquals(List.of(new LeaderboardEntry(BOB.toLowerCase(), 40)),
                fx.leaderboards.getLeaderboards("202501").missionTop().subList(0, 1));
    }

    @Test
    void combinedStreakRankingUsesBestNotMonthlySum() {
        fx.clock.set(Instant.parse("2025-01-30T08:00:00Z"));
        for (int i = 0; i < 4; i++) {
            fx.streakTracker.trackDailyActivity(ALICE);
            fx.clock.advanceDays(1);
        }
        fx.clock.advanceDays(3);
        fx.streakTracker.trackDailyActivity(ALICE);
        fx.streakTracker.trackDailyActivity(BOB);

        List<LeaderboardEntry> top = fx.leaderboards.getLeaderboards("combined").streakTop();

        assertEquals(List.of(
                new LeaderboardEntry(ALICE_LOWER, 4),
                new LeaderboardEntry(BOB.toLowerCase(), 1)), top);
    }

    @Test
    void combinedStreakSkipsZeroBestAndSubNamespaces() {
        fx.store.set(fx.keys.streak(CAROL.toLowerCase()), "{\"current\":0,\"best\":0,\"lastActive\":\"\"}");
        fx.streakTracker.trackDailyActivity(ALICE);

        List<LeaderboardEntry> top = fx.leaderboards.getLeaderboards(null).streakTop();

        // streak:leaderboard:* 與 streak:activity:* 不被當成地址
        assertEquals(List.of(new LeaderboardEntry(ALICE_LOWER, 1)), top);
    }

    @Test
    void monthlyStreakRankingReflectsLatestValue() {
        fx.streakTracker.trackDailyActivity(ALICE);
        fx.clock.advanceDays(1);
        fx.streakTracker.trackDailyActivity(ALICE);
        fx.streakTracker.trackDailyActivity(BOB);

        List<LeaderboardEntry> top = fx.leaderboards.getLeaderboards("202501").streakTop();

        assertEquals(new LeaderboardEntry(ALICE_LOWER, 2), top.get(0));
        assertEquals(new LeaderboardEntry(BOB.toLowerCase(), 1), top.get(1));
    }

    @Test
    void rankingsAreTruncatedToConfiguredSize() {
        GamificationFixture small = new GamificationFixture(GamificationFixture.props(5, 2, false));
        String[] addresses = {ALICE, BOB, CAROL};
        for (String a : addresses) {
            small.streakTracker.trackDailyActivity(a);
            small.missionTracker.applyTask(a, MissionTask.S3_SEND_QUEST, null, 1);
            small.missionTracker.applyTask(a, MissionTask.S3_PLACE_ORDER, null, 1);
            small.missionTracker.applyTask(a, MissionTask.S3_CLAIM_STAKE, null, 1);
        }

        assertEquals(2, small.leaderboards.getLeaderboards("202501").missionTop().size());
        assertEquals(2, small.leaderboards.getLeaderboards("202501").streakTop().size());
        assertEquals(2, small.leaderboards.getLeaderboards(null).missionTop().size());
        assertEquals(2, small.leaderboards.getLeaderboards(null).streakTop().size());
    }

    @Test
    void emptyMonthReturnsEmptyLists() {
        Leaderboards boards = fx.leaderboards.getLeaderboards("203001");
        assertTrue(boards.streakTop().isEmpty());
        assertTrue(boards.missionTop().isEmpty());
    }

    @Test
    void invalidMonthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> fx.leaderboards.getLeaderboards("2025-01"));
        assertThrows(IllegalArgumentException.class, () -> fx.leaderboards.getLeaderboards("202513"));
    }

    @Test
    void combinedAliasesAreCaseInsensitive() {
        assertTrue(LeaderboardAggregator.isCombined("LIFETIME"));
        assertTrue(LeaderboardAggregator.isCombined(" "));
        assertFalse(LeaderboardAggregator.isCombined("202501"));
    }
}
