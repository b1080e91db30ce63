package com.resilia.neurogrid.core.telemetry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * 外部天气预报推送，后到的覆盖先到的
 */
@Value
@Builder
@Jacksonized
public class ForecastFeedUpdate {

    String provider;

    long issuedAt;

    @Singular
    List<WeatherPoint> points;

    /**
     * 取与目标时刻最近、且间隔不超过 maxGapMs 的预报点
     */
    public Optional<WeatherPoint> closestPoint(long timestamp, long maxGapMs) {
        WeatherPoint best = null;
        long bestGap = Long.MAX_VALUE;
        for (WeatherPoint point : points) {
            long gap = Math.abs(point.getTimestamp() - timestamp);
            if (gap < bestGap) {
                best = point;
                bestGap = gap;
            }
        }
        if (best == null || bestGap > maxGapMs) {
            return Optional.empty();
        }
        return Optional.of(best);
    }
}
