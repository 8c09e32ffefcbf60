package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.config.GamificationProperties;
import com.aiinpocket.gmtracker.model.dto.MissionDay;
import com.aiinpocket.gmtracker.model.dto.ProofRecord;
import com.aiinpocket.gmtracker.model.enums.MissionTask;
import com.aiinpocket.gmtracker.model.event.MissionDayCompleted;
import com.aiinpocket.gmtracker.store.KeyValueStore;
import com.aiinpocket.gmtracker.store.KeyValueStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * 每日任務進度服務。
 *
 * <p>任務進度以「讀取 → 套用 → 條件寫入」的樂觀並行控制更新：
 * <ol>
 *   <li>讀取紀錄目前的原始 JSON</li>
 *   <li>解析、套用子任務轉移、重新評估區塊並計分、重新序列化</li>
 *   <li>以 compare-and-set 寫回，條件為 key 仍是步驟 1 讀到的值；失敗代表有人先寫入，從步驟 1 重來</li>
 * </ol>
 * 兩個請求同時完成不同子任務時都會保留；同時完成同一子任務時，後寫入者重新評估會發現區塊已 done，不會重複給分。
 *
 * <p>重試次數上限由 gamification.max-update-attempts 控制，用盡時拋出
 * {@link MissionUpdateContentionException}，絕不默默丟棄。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MissionProgressTracker {

    static final String DAY_COMPLETE_REWARD = "mission-day-complete:";

    private final KeyValueStore store;
    private final GmKeys keys;
    private final GmRecordCodec codec;
    private final SideEffectDispatcher sideEffects;
    private final RewardIdempotencyService idempotency;
    private final ApplicationEventPublisher eventPublisher;
    private final GamificationProperties props;
    private final Clock clock;

    /**
     * 取得指定日（預設今日）的任務紀錄，第一次讀取時建立並保存全零紀錄（停用模式下不保存）。
     */
    public MissionDay getMissionDay(String address, LocalDate day) {
        String addr = GmKeys.normalizeAddress(address);
        LocalDate d = day != null ? day : LocalDate.now(clock);
        String key = keys.missions(addr, d);
        String raw = store.get(key).orElse(null);
        if (raw != null) {
            return codec.readMissionDay(raw, d.toString());
        }
        MissionDay initial = MissionDay.initial(d.toString());
        if (props.disabled()) {
            return initial;
        }
        // 只在 key 仍不存在時建立，避免蓋掉同時寫入的進度
        if (!store.compareAndSet(key, null, codec.write(initial))) {
            return codec.readMissionDay(store.get(key).orElse(null), d.toString());
        }
        return initial;
    }

    public MissionDay applyTask(String address, String taskId, ProofRecord proof, Integer count) {
        return applyTask(address, MissionTask.fromId(taskId), proof, count == null ? 1 : count);
    }

    /**
     * 套用一次任務完成。
     *
     * @param count 計數型子任務的增量，限制在 [1, counterIncrementCap]；布林子任務忽略
     * @throws MissionUpdateContentionException 重試用盡仍輸給其他寫入者
     * @throws GamificationStoreException       最後一次嘗試仍遇到儲存層錯誤
     */
    public MissionDay applyTask(String address, MissionTask task, ProofRecord proof, int count) {
        String addr = GmKeys.normalizeAddress(address);
        LocalDate today = LocalDate.now(clock);
        String key = keys.missions(addr, today);

        if (props.disabled()) {
            return codec.readMissionDay(store.get(key).orElse(null), today.toString());
        }

        int safeCount = Math.min(props.counterIncrementCap(), Math.max(1, count));
        int maxAttempts = props.maxUpdateAttempts();
        KeyValueStoreException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String raw = store.get(key).orElse(null);
                MissionDay mission = codec.readMissionDay(raw, today.toString());
                boolean wasComplete = mission.getCompletedAt() != null;

                task.apply(mission, safeCount);
                int gained = mission.awardCompletedSections(clock.millis());

                if (!store.compareAndSet(key, raw, codec.write(mission))) {
                    lastError = null;
                    log.debug("[任務進度] {} {} 寫入衝突，重試 ({}/{})", addr, task.getId(), attempt, maxAttempts);
                    continue;
                }

                if (gained > 0) {
                    log.info("[任務進度] {} 完成 {} → +{} 分 (今日 {} 分)", addr, task.getId(), gained, mission.getPts());
                }
                afterCommit(addr, today, task, proof, gained, !wasComplete && mission.getCompletedAt() != null, mission);
                return mission;
            } catch (KeyValueStoreException e) {
                lastError = e;
                log.warn("[任務進度] {} {} 儲存層錯誤 ({}/{}): {}", addr, task.getId(), attempt, maxAttempts, e.getMessage());
            }
        }

        if (lastError != null) {
            throw new GamificationStoreException("Failed to update mission progress for " + key, lastError);
        }
        log.warn("[任務進度] {} {} 連續 {} 次寫入衝突，放棄", addr, task.getId(), maxAttempts);
        throw new MissionUpdateContentionException(key, maxAttempts);
    }

    /**
     * 取得地址在某月（或全部月份加總）的任務積分。
     */
    public long getMissionScore(String address, String month) {
        String addr = GmKeys.normalizeAddress(address);
        if (LeaderboardAggregator.isCombined(month)) {
            long total = 0;
            for (String key : store.scanKeys(keys.missionsLeaderboardPattern())) {
                try {
                    total += Math.round(store.sortedSetScore(key, addr).orElse(0d));
                } catch (KeyValueStoreException e) {
                    log.warn("[任務進度] 讀取 {} 的 {} 分數失敗: {}", key, addr, e.getMessage());
                }
            }
            return total;
        }
        String yyyymm = LeaderboardAggregator.requireMonth(month);
        return Math.round(store.sortedSetScore(keys.missionsLeaderboard(yyyymm), addr).orElse(0d));
    }

    private void afterCommit(String addr, LocalDate day, MissionTask task, ProofRecord proof,
                             int gained, boolean completedNow, MissionDay mission) {
        if (proof != null && proof.hasContent()) {
            sideEffects.dispatch("任務證明 " + addr + " " + task.getId(),
                    () -> store.set(keys.proof(addr, day, task.getId()), codec.write(proof)));
        }
        if (gained > 0) {
            sideEffects.dispatch("任務積分榜 " + addr,
                    () -> store.sortedSetIncrementScore(keys.missionsLeaderboard(GmKeys.month(day)), addr, gained));
        }
        if (completedNow) {
            long completedAt = mission.getCompletedAt();
            sideEffects.dispatch("每日任務完成獎勵 " + addr, () -> {
                if (idempotency.claim(addr, DAY_COMPLETE_REWARD + day)) {
                    eventPublisher.publishEvent(new MissionDayCompleted(addr, day.toString(), completedAt));
                }
            });
        }
    }
}
