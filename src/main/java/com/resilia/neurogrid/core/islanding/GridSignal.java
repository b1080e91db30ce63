package com.resilia.neurogrid.core.islanding;

import com.resilia.neurogrid.common.domain.entity.TelemetrySample;
import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import com.resilia.neurogrid.core.telemetry.TelemetryWindow;
import lombok.Builder;
import lombok.Value;

/**
 * 主网侧信号，缺失的测量为 null
 */
@Value
@Builder
public class GridSignal {

    /**
     * 最后一次主网心跳时间，从未收到为 0
     */
    long lastHeartbeatAt;

    Double frequencyHz;

    Double voltagePu;

    Double phaseDeg;

    public static GridSignal from(TelemetryWindow window) {
        return GridSignal.builder()
                .lastHeartbeatAt(window.mostRecent(TelemetryQuantity.GRID_HEARTBEAT)
                        .map(TelemetrySample::getTimestamp).orElse(0L))
                .frequencyHz(freshValue(window, TelemetryQuantity.GRID_FREQUENCY_HZ))
                .voltagePu(freshValue(window, TelemetryQuantity.GRID_VOLTAGE_PU))
                .phaseDeg(freshValue(window, TelemetryQuantity.GRID_PHASE_DEG))
                .build();
    }

    private static Double freshValue(TelemetryWindow window, TelemetryQuantity quantity) {
        return window.mostRecent(quantity)
                .filter(window::isFresh)
                .map(TelemetrySample::getValue)
                .orElse(null);
    }
}
