package com.aiinpocket.gmtracker.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 附帶作業分派器。
 * 主寫入成功後的排行榜分數、活躍集合、任務證明等作業提交到專用執行緒池執行。
 * 失敗只記錄日誌與計數，不影響也不回滾主寫入；排行榜是可由每日紀錄重算的最終一致投影。
 */
@Service
@Slf4j
public class SideEffectDispatcher {

    private final TaskExecutor executor;
    private final AtomicLong failures = new AtomicLong();

    public SideEffectDispatcher(@Qualifier("gamificationSideEffectExecutor") TaskExecutor executor) {
        this.executor = executor;
    }

    public void dispatch(String description, Runnable effect) {
        try {
            executor.execute(() -> runGuarded(description, effect));
        } catch (TaskRejectedException e) {
            failures.incrementAndGet();
            log.warn("[背景作業] {} 無法排入執行緒池: {}", description, e.getMessage());
        }
    }

    /** 啟動以來失敗的附帶作業數 */
    public long failureCount() {
        return failures.get();
    }

    private void runGuarded(String description, Runnable effect) {
        try {
            effect.run();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.warn("[背景作業] {} 失敗: {}", description, e.getMessage(), e);
        }
    }
}
