package com.resilia.neurogrid.core.telemetry;

import com.resilia.neurogrid.common.domain.entity.TelemetrySample;
import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import com.resilia.neurogrid.common.exception.GridException;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 遥测接入
 *
 * <p>{@link #submit} 可被任意线程调用，样本先进入无锁收件箱；
 * {@link #drain} 只由控制线程调用，负责把样本并入滚动窗口并生成快照。</p>
 */
@Slf4j
@Component
public class TelemetryIngest {

    private final NeuroGridProperties.TelemetryConfig config;

    private final Queue<TelemetrySample> inbox = new ConcurrentLinkedQueue<>();
    private final AtomicReference<ForecastFeedUpdate> latestFeed = new AtomicReference<>();

    // 以下状态只属于控制线程
    private final Map<TelemetryQuantity, Map<String, List<TelemetrySample>>> window =
            new EnumMap<>(TelemetryQuantity.class);

    private final AtomicLong acceptedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong evictedCount = new AtomicLong();

    public TelemetryIngest(NeuroGridProperties properties) {
        this.config = properties.getTelemetry();
    }

    public void submit(TelemetrySample sample) {
        validate(sample);
        inbox.add(sample);
        acceptedCount.incrementAndGet();
    }

    /**
     * 批量提交，先整体校验，任一无效则整批拒绝
     */
    public int submitAll(Collection<TelemetrySample> samples) {
        if (samples == null || samples.isEmpty()) {
            return 0;
        }
        for (TelemetrySample sample : samples) {
            validate(sample);
        }
        inbox.addAll(samples);
        acceptedCount.addAndGet(samples.size());
        return samples.size();
    }

    public void submitForecastFeed(ForecastFeedUpdate update) {
        if (update == null || update.getPoints() == null || update.getPoints().isEmpty()) {
            throw GridException.invalidTelemetry("forecast-feed", "天气预报推送为空");
        }
        latestFeed.set(update);
        log.debug("收到天气预报推送: provider={}, points={}", update.getProvider(), update.getPoints().size());
    }

    public ForecastFeedUpdate latestForecastFeed() {
        return latestFeed.get();
    }

    /**
     * 将收件箱并入窗口，淘汰过期样本，返回不可变快照
     */
    public TelemetryWindow drain(long now) {
        long cutoff = now - config.getWindowMs();
        TelemetrySample sample;
        int merged = 0;
        while ((sample = inbox.poll()) != null) {
            if (sample.getTimestamp() < cutoff) {
                rejectedCount.incrementAndGet();
                log.debug("丢弃超出窗口的样本: {} @ {}", sample.seriesKey(), sample.getTimestamp());
                continue;
            }
            insertOrdered(sample);
            merged++;
        }
        evictOlderThan(cutoff);
        if (merged > 0) {
            log.trace("本周期并入遥测样本 {} 条", merged);
        }
        return new TelemetryWindow(now, config.getStalenessMs(), window);
    }

    public Map<String, Long> statistics() {
        Map<String, Long> stats = new HashMap<>();
        stats.put("accepted", acceptedCount.get());
        stats.put("rejected", rejectedCount.get());
        stats.put("evicted", evictedCount.get());
        stats.put("pending", (long) inbox.size());
        return stats;
    }

    private void validate(TelemetrySample sample) {
        if (sample == null) {
            throw GridException.invalidTelemetry("unknown", "遥测样本为空");
        }
        String source = sample.getSource();
        if (source == null || source.isBlank()) {
            throw GridException.invalidTelemetry("unknown", "遥测样本缺少来源");
        }
        if (sample.getQuantity() == null) {
            throw GridException.invalidTelemetry(source, "遥测样本缺少数量类型");
        }
        if (!Double.isFinite(sample.getValue())) {
            throw GridException.invalidTelemetry(source, "遥测值不是有限数: " + sample.getValue());
        }
        if (sample.getTimestamp() <= 0) {
            throw GridException.invalidTelemetry(source, "遥测时间戳无效: " + sample.getTimestamp());
        }
        if (sample.getQuantity() == TelemetryQuantity.STORAGE_SOC
                && (sample.getValue() < 0.0 || sample.getValue() > 1.0)) {
            throw GridException.invalidTelemetry(source, "SOC 超出 0..1 范围: " + sample.getValue());
        }
    }

    private void insertOrdered(TelemetrySample sample) {
        List<TelemetrySample> samples = window
                .computeIfAbsent(sample.getQuantity(), q -> new TreeMap<>())
                .computeIfAbsent(sample.getSource(), s -> new ArrayList<>());
        int index = samples.size();
        while (index > 0 && samples.get(index - 1).getTimestamp() > sample.getTimestamp()) {
            index--;
        }
        samples.add(index, sample);
        int overflow = samples.size() - config.getMaxSamplesPerSeries();
        if (overflow > 0) {
            samples.subList(0, overflow).clear();
            evictedCount.addAndGet(overflow);
        }
    }

    private void evictOlderThan(long cutoff) {
        Iterator<Map<String, List<TelemetrySample>>> quantities = window.values().iterator();
        while (quantities.hasNext()) {
            Map<String, List<TelemetrySample>> bySource = quantities.next();
            Iterator<List<TelemetrySample>> sources = bySource.values().iterator();
            while (sources.hasNext()) {
                List<TelemetrySample> samples = sources.next();
                int stale = 0;
                while (stale < samples.size() && samples.get(stale).getTimestamp() < cutoff) {
                    stale++;
                }
                if (stale > 0) {
                    samples.subList(0, stale).clear();
                    evictedCount.addAndGet(stale);
                }
                if (samples.isEmpty()) {
                    sources.remove();
                }
            }
            if (bySource.isEmpty()) {
                quantities.remove();
            }
        }
    }
}
