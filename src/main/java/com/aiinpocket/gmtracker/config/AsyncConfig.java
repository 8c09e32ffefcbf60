package com.aiinpocket.gmtracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 非同步任務配置。
 *
 * <p>{@code gamificationSideEffectExecutor} 專門執行任務/連續登入寫入成功後的附帶作業：
 * 排行榜分數、每日活躍集合、任務證明。這些作業與主流程隔離，
 * 即使 Redis 回應緩慢也不會拖住請求執行緒。
 */
@Configuration
public class AsyncConfig {

    /**
     * 附帶作業執行緒池。
     * 核心 2 線程 / 最大 4 線程，隊列容量 500：附帶作業都是單一 Redis 指令，量大但很輕。
     * 隊列滿時由呼叫端執行緒直接執行，不丟棄排行榜更新。
     */
    @Bean
    public TaskExecutor gamificationSideEffectExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("gm-side-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
