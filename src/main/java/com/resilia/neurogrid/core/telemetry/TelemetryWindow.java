package com.resilia.neurogrid.core.telemetry;

import com.resilia.neurogrid.common.domain.entity.TelemetrySample;
import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 滚动遥测窗口的不可变快照，由控制线程在周期开始时生成
 */
public final class TelemetryWindow {

    private final long capturedAt;
    private final long stalenessMs;

    /**
     * quantity -> source -> 按时间升序的样本
     */
    private final Map<TelemetryQuantity, Map<String, List<TelemetrySample>>> series;

    TelemetryWindow(long capturedAt, long stalenessMs,
                    Map<TelemetryQuantity, Map<String, List<TelemetrySample>>> series) {
        this.capturedAt = capturedAt;
        this.stalenessMs = stalenessMs;
        Map<TelemetryQuantity, Map<String, List<TelemetrySample>>> copy = new EnumMap<>(TelemetryQuantity.class);
        series.forEach((quantity, bySource) -> {
            Map<String, List<TelemetrySample>> sources = new LinkedHashMap<>();
            bySource.forEach((source, samples) -> {
                if (!samples.isEmpty()) {
                    sources.put(source, List.copyOf(samples));
                }
            });
            if (!sources.isEmpty()) {
                copy.put(quantity, Collections.unmodifiableMap(sources));
            }
        });
        this.series = Collections.unmodifiableMap(copy);
    }

    public static TelemetryWindow empty(long capturedAt, long stalenessMs) {
        return new TelemetryWindow(capturedAt, stalenessMs, Collections.emptyMap());
    }

    public long getCapturedAt() {
        return capturedAt;
    }

    public long getStalenessMs() {
        return stalenessMs;
    }

    public boolean hasObserved(TelemetryQuantity quantity) {
        return series.containsKey(quantity);
    }

    public List<String> sources(TelemetryQuantity quantity) {
        return new ArrayList<>(series.getOrDefault(quantity, Collections.emptyMap()).keySet());
    }

    public List<TelemetrySample> series(TelemetryQuantity quantity, String source) {
        return series.getOrDefault(quantity, Collections.emptyMap()).getOrDefault(source, Collections.emptyList());
    }

    public Optional<TelemetrySample> latest(TelemetryQuantity quantity, String source) {
        List<TelemetrySample> samples = series(quantity, source);
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    }

    /**
     * 该数量所有来源中时间最新的一条
     */
    public Optional<TelemetrySample> mostRecent(TelemetryQuantity quantity) {
        TelemetrySample best = null;
        for (List<TelemetrySample> samples : series.getOrDefault(quantity, Collections.emptyMap()).values()) {
            TelemetrySample last = samples.get(samples.size() - 1);
            if (best == null || last.getTimestamp() > best.getTimestamp()) {
                best = last;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * 各来源最新值之和
     */
    public double sumLatest(TelemetryQuantity quantity) {
        double sum = 0.0;
        for (List<TelemetrySample> samples : series.getOrDefault(quantity, Collections.emptyMap()).values()) {
            sum += samples.get(samples.size() - 1).getValue();
        }
        return sum;
    }

    /**
     * 各来源线性趋势之和（单位：值/毫秒）
     */
    public double sumSlopePerMs(TelemetryQuantity quantity) {
        double sum = 0.0;
        for (List<TelemetrySample> samples : series.getOrDefault(quantity, Collections.emptyMap()).values()) {
            sum += slopePerMs(samples);
        }
        return sum;
    }

    /**
     * 数量是否新鲜：所有来源的最新样本都在过期阈值内
     */
    public boolean isFresh(TelemetryQuantity quantity) {
        Map<String, List<TelemetrySample>> bySource = series.get(quantity);
        if (bySource == null) {
            return false;
        }
        for (List<TelemetrySample> samples : bySource.values()) {
            if (!isFresh(samples.get(samples.size() - 1))) {
                return false;
            }
        }
        return true;
    }

    public boolean isFresh(TelemetrySample sample) {
        return sample != null && capturedAt - sample.getTimestamp() <= stalenessMs;
    }

    public int sampleCount() {
        int count = 0;
        for (Map<String, List<TelemetrySample>> bySource : series.values()) {
            for (List<TelemetrySample> samples : bySource.values()) {
                count += samples.size();
            }
        }
        return count;
    }

    // 最小二乘斜率
    static double slopePerMs(List<TelemetrySample> samples) {
        int n = samples.size();
        if (n < 2) {
            return 0.0;
        }
        long origin = samples.get(0).getTimestamp();
        double meanT = 0.0;
        double meanV = 0.0;
        for (TelemetrySample sample : samples) {
            meanT += sample.getTimestamp() - origin;
            meanV += sample.getValue();
        }
        meanT /= n;
        meanV /= n;
        double numerator = 0.0;
        double denominator = 0.0;
        for (TelemetrySample sample : samples) {
            double dt = (sample.getTimestamp() - origin) - meanT;
            numerator += dt * (sample.getValue() - meanV);
            denominator += dt * dt;
        }
        return denominator > 0 ? numerator / denominator : 0.0;
    }
}
