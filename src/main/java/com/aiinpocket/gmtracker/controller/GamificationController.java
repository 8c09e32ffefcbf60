package com.aiinpocket.gmtracker.controller;

import com.aiinpocket.gmtracker.model.dto.AddressRequest;
import com.aiinpocket.gmtracker.model.dto.Leaderboards;
import com.aiinpocket.gmtracker.model.dto.MissionDay;
import com.aiinpocket.gmtracker.model.dto.MissionTaskRequest;
import com.aiinpocket.gmtracker.model.dto.StreakRecord;
import com.aiinpocket.gmtracker.service.LeaderboardAggregator;
import com.aiinpocket.gmtracker.service.MissionProgressTracker;
import com.aiinpocket.gmtracker.service.StreakTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/api/gamification")
@RequiredArgsConstructor
public class GamificationController {

    private static final Pattern ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    private final StreakTracker streakTracker;
    private final MissionProgressTracker missionTracker;
    private final LeaderboardAggregator leaderboardAggregator;

    @GetMapping("/streak")
    public Map<String, Object> getStreak(@RequestParam(required = false) String address) {
        StreakRecord streak = streakTracker.getStreak(requireAddress(address));
        return Map.of("success", true, "streak", streak);
    }

    @PostMapping("/streak")
    public Map<String, Object> trackActivity(@RequestBody AddressRequest body) {
        StreakRecord streak = streakTracker.trackDailyActivity(requireAddress(body.address()));
        return Map.of("success", true, "streak", streak);
    }

    @GetMapping("/missions")
    public Map<String, Object> getMissions(@RequestParam(required = false) String address,
                                           @RequestParam(required = false) String day) {
        MissionDay missionDay = missionTracker.getMissionDay(requireAddress(address), parseDay(day));
        return Map.of("success", true, "day", missionDay);
    }

    @PostMapping("/missions")
    public Map<String, Object> applyTask(@RequestBody MissionTaskRequest body) {
        MissionDay missionDay = missionTracker.applyTask(
                requireAddress(body.address()), body.taskId(), body.proof(), body.count());
        return Map.of("success", true, "day", missionDay);
    }

    @GetMapping("/missions/score")
    public Map<String, Object> getMissionScore(@RequestParam(required = false) String address,
                                               @RequestParam(required = false) String month) {
        long score = missionTracker.getMissionScore(requireAddress(address), month);
        return Map.of("success", true, "score", score);
    }

    @GetMapping("/leaderboards")
    public Map<String, Object> getLeaderboards(@RequestParam(required = false) String month) {
        Leaderboards boards = leaderboardAggregator.getLeaderboards(month);
        return Map.of("success", true,
                "streakTop", boards.streakTop(),
                "missionTop", boards.missionTop());
    }

    private static String requireAddress(String address) {
        if (address == null || !ADDRESS.matcher(address).matches()) {
            throw new IllegalArgumentException("請提供有效的錢包地址");
        }
        return address;
    }

    private static LocalDate parseDay(String day) {
        if (day == null || day.isBlank()) return null;
        try {
            return LocalDate.parse(day.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("日期格式不正確: " + day);
        }
    }
}
