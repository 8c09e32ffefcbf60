package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.config.GamificationProperties;
import com.aiinpocket.gmtracker.model.dto.StreakRecord;
import com.aiinpocket.gmtracker.store.KeyValueStore;
import com.aiinpocket.gmtracker.store.KeyValueStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 連續活躍天數服務。
 *
 * <p>每個地址一筆 {@link StreakRecord}，以 UTC 日曆日計算。
 * 同一天重複呼叫 {@link #trackDailyActivity} 直接回傳既有紀錄，所以不需要 compare-and-set：
 * 唯一的競爭是同一使用者同日的重複活動，早退檢查已經讓它成為冪等操作。
 *
 * <p>斷掉的連續天數不靠排程清除，而是在讀取時由 {@link #normalizeStreakIfMissed} 延遲修正。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreakTracker {

    private final KeyValueStore store;
    private final GmKeys keys;
    private final GmRecordCodec codec;
    private final SideEffectDispatcher sideEffects;
    private final GamificationProperties props;
    private final Clock clock;

    /**
     * 記錄今日活躍。
     * 昨天有活躍則連續天數 +1，否則從 1 重新開始；best 取兩者較大值。
     * 成功後以背景作業更新當日活躍集合與當月連續活躍榜（覆寫為最新 current，非累加）。
     */
    public StreakRecord trackDailyActivity(String address) {
        String addr = GmKeys.normalizeAddress(address);
        if (props.disabled()) {
            return getStreak(addr);
        }

        LocalDate today = LocalDate.now(clock);
        StreakRecord s = load(addr);
        LocalDate lastActive = parseDay(s.lastActive());
        if (today.equals(lastActive)) {
            return s;
        }

        boolean consecutive = today.minusDays(1).equals(lastActive);
        int current = consecutive ? s.current() + 1 : 1;
        int best = Math.max(s.best(), current);
        StreakRecord updated = new StreakRecord(addr, current, best, today.toString());
        store.set(keys.streak(addr), codec.write(updated));

        log.debug("[連續登入] {} 活躍 {}: current={}, best={}", addr, today, current, best);

        sideEffects.dispatch("活躍集合 " + addr,
                () -> store.setAdd(keys.streakActivity(today), addr));
        sideEffects.dispatch("連續活躍榜 " + addr,
                () -> store.sortedSetSetScore(keys.streakLeaderboard(GmKeys.month(today)), addr, current));
        return updated;
    }

    /**
     * 對外讀取目前連續天數的唯一入口，一律經過 {@link #normalizeStreakIfMissed}。
     */
    public StreakRecord getStreak(String address) {
        String addr = GmKeys.normalizeAddress(address);
        return normalizeStreakIfMissed(addr, load(addr));
    }

    /**
     * 讀取時修正：最後活躍日既不是今天也不是昨天（至少漏掉一整天）時，
     * current 歸零、保留 best，並寫回儲存讓之後的讀取一致。
     * 寫回失敗時仍回傳修正後的值，下次讀取會再修正一次。停用模式下只回傳修正值，不寫回。
     */
    public StreakRecord normalizeStreakIfMissed(String address, StreakRecord record) {
        LocalDate lastActive = parseDay(record.lastActive());
        if (lastActive == null || record.current() == 0) {
            return record;
        }
        LocalDate today = LocalDate.now(clock);
        if (lastActive.equals(today) || lastActive.equals(today.minusDays(1))) {
            return record;
        }

        StreakRecord corrected = record.withCurrent(0);
        if (props.disabled()) {
            return corrected;
        }
        try {
            store.set(keys.streak(GmKeys.normalizeAddress(address)), codec.write(corrected));
            log.debug("[連續登入] {} 已中斷（最後活躍 {}），current 歸零", address, lastActive);
        } catch (KeyValueStoreException e) {
            log.warn("[連續登入] {} 中斷修正寫回失敗: {}", address, e.getMessage());
        }
        return corrected;
    }

    private StreakRecord load(String addr) {
        String raw = store.get(keys.streak(addr)).orElse(null);
        return codec.readStreak(raw, addr).orElseGet(() -> StreakRecord.empty(addr));
    }

    static LocalDate parseDay(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
