package com.aiinpocket.gmtracker.store;

import com.aiinpocket.gmtracker.config.GamificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis 實作（Spring Data Redis + Lettuce）。
 *
 * <p>compare-and-set 以 Lua 腳本執行，Redis 單執行緒模型保證 GET 比對與 SET 之間不會插入其他指令。
 * 所有 {@link DataAccessException} 轉換為 {@link KeyValueStoreException}。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    /**
     * ARGV[1] = 1 表示預期 key 存在且值為 ARGV[2]；0 表示預期 key 不存在。ARGV[3] 為新值。
     */
    static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>("""
            local current = redis.call('GET', KEYS[1])
            if ARGV[1] == '1' then
              if current ~= ARGV[2] then return 0 end
            else
              if current then return 0 end
            end
            redis.call('SET', KEYS[1], ARGV[3])
            return 1
            """, Long.class);

    private final StringRedisTemplate redis;
    private final GamificationProperties props;

    @Override
    public Optional<String> get(String key) {
        return call("GET " + key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value) {
        call("SET " + key, () -> {
            redis.opsForValue().set(key, value);
            return null;
        });
    }

    @Override
    public boolean compareAndSet(String key, String expected, String next) {
        Long result = call("CAS " + key, () -> redis.execute(COMPARE_AND_SET, List.of(key),
                expected == null ? "0" : "1",
                expected == null ? "" : expected,
                next));
        return result != null && result == 1L;
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) return 0;
        Long removed = call("DEL x" + keys.size(), () -> redis.delete(keys));
        return removed == null ? 0 : removed;
    }

    @Override
    public List<String> scanKeys(String pattern) {
        return call("SCAN " + pattern, () -> {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(props.scanCount()).build();
            try (Cursor<String> cursor = redis.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    @Override
    public void sortedSetIncrementScore(String key, String member, double delta) {
        call("ZINCRBY " + key, () -> redis.opsForZSet().incrementScore(key, member, delta));
    }

    @Override
    public void sortedSetSetScore(String key, String member, double score) {
        call("ZADD " + key, () -> redis.opsForZSet().add(key, member, score));
    }

    @Override
    public Optional<Double> sortedSetScore(String key, String member) {
        return call("ZSCORE " + key, () -> Optional.ofNullable(redis.opsForZSet().score(key, member)));
    }

    @Override
    public List<ScoredMember> sortedSetRangeDescending(String key, long offset, long limit) {
        long end = limit < 0 ? -1 : offset + limit - 1;
        return call("ZREVRANGE " + key, () -> {
            Set<TypedTuple<String>> tuples = redis.opsForZSet().reverseRangeWithScores(key, offset, end);
            List<ScoredMember> out = new ArrayList<>();
            if (tuples == null) return out;
            for (TypedTuple<String> t : tuples) {
                if (t.getValue() != null && t.getScore() != null) {
                    out.add(new ScoredMember(t.getValue(), t.getScore()));
                }
            }
            return out;
        });
    }

    @Override
    public void setAdd(String key, String member) {
        call("SADD " + key, () -> redis.opsForSet().add(key, member));
    }

    private <T> T call(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.debug("[Redis] {} 失敗: {}", command, e.getMessage());
            throw new KeyValueStoreException("Redis " + command + " failed", e);
        }
    }
}
