package com.aiinpocket.gmtracker.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 快取配置。
 * 使用 Caffeine 本地快取總榜（需掃描全部月份，成本較高），TTL 由 gamification.combined-cache-ttl 控制。
 * 管理重置時整個快取會被清除。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String COMBINED_LEADERBOARDS = "combinedLeaderboards";

    @Bean
    public CacheManager cacheManager(GamificationProperties props) {
        CaffeineCacheManager manager = new CaffeineCacheManager(COMBINED_LEADERBOARDS);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(props.combinedCacheTtl())
                .maximumSize(10));
        return manager;
    }
}
