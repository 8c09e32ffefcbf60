package com.aiinpocket.gmtracker.service;

import com.aiinpocket.gmtracker.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * 獎勵冪等標記。同一地址、同一 rewardId 只有第一個呼叫者能取得發放權。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardIdempotencyService {

    private final KeyValueStore store;
    private final GmKeys keys;
    private final GmRecordCodec codec;
    private final Clock clock;

    /**
     * @return true 如果這次呼叫建立了標記（應發放獎勵）；false 代表已經發放過
     */
    public boolean claim(String address, String rewardId) {
        String addr = GmKeys.normalizeAddress(address);
        if (rewardId == null || rewardId.isBlank()) {
            throw new IllegalArgumentException("rewardId is required");
        }
        String marker = codec.write(Map.of("rewardId", rewardId, "claimedAt", clock.millis()));
        boolean claimed = store.compareAndSet(keys.idempotency(addr, rewardId), null, marker);
        if (!claimed) {
            log.debug("[獎勵冪等] {} 的 {} 已發放過，略過", addr, rewardId);
        }
        return claimed;
    }
}
