package com.resilia.neurogrid.core.controller;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 控制周期耗时监控
 *
 * <p>连续 maxOverruns 个周期超出预算时置位通信劣化信号，任一周期回到预算内即清除。</p>
 */
@Slf4j
public class CycleBudgetMonitor {

    private static final long STATISTICS_CYCLES = 60;

    private final long budgetMs;
    private final int maxOverruns;

    private final AtomicLong totalCycles = new AtomicLong();
    private final AtomicLong totalOverruns = new AtomicLong();
    private final AtomicLong totalDurationMs = new AtomicLong();
    private final AtomicLong maxDurationMs = new AtomicLong();
    private final AtomicLong lastDurationMs = new AtomicLong();
    private final AtomicInteger consecutiveOverruns = new AtomicInteger();
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public CycleBudgetMonitor(long budgetMs, int maxOverruns) {
        this.budgetMs = budgetMs;
        this.maxOverruns = Math.max(1, maxOverruns);
    }

    public void record(long durationMs) {
        long cycles = totalCycles.incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
        lastDurationMs.set(durationMs);
        maxDurationMs.accumulateAndGet(durationMs, Math::max);

        if (durationMs > budgetMs) {
            totalOverruns.incrementAndGet();
            int consecutive = consecutiveOverruns.incrementAndGet();
            log.warn("控制周期超预算: {}ms > {}ms (连续 {} 次)", durationMs, budgetMs, consecutive);
            if (consecutive >= maxOverruns && degraded.compareAndSet(false, true)) {
                log.error("控制周期连续 {} 次超预算, 置位通信劣化信号", consecutive);
            }
        } else {
            consecutiveOverruns.set(0);
            if (degraded.compareAndSet(true, false)) {
                log.info("控制周期恢复到预算内, 清除通信劣化信号");
            }
        }

        if (cycles % STATISTICS_CYCLES == 0) {
            logStatistics();
        }
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public BudgetStats snapshot() {
        long cycles = totalCycles.get();
        return new BudgetStats(budgetMs, cycles, totalOverruns.get(), consecutiveOverruns.get(),
                lastDurationMs.get(), maxDurationMs.get(),
                cycles > 0 ? (double) totalDurationMs.get() / cycles : 0.0, degraded.get());
    }

    private void logStatistics() {
        BudgetStats stats = snapshot();
        log.info("控制周期统计 - 总周期: {}, 超预算: {}, 平均耗时: {}ms, 最大耗时: {}ms",
                stats.totalCycles(), stats.totalOverruns(),
                String.format("%.2f", stats.averageDurationMs()), stats.maxDurationMs());
    }

    public record BudgetStats(long budgetMs, long totalCycles, long totalOverruns, int consecutiveOverruns,
                              long lastDurationMs, long maxDurationMs, double averageDurationMs,
                              boolean degraded) {
    }
}
