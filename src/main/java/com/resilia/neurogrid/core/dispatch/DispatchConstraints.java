package com.resilia.neurogrid.core.dispatch;

import lombok.Builder;
import lombok.Value;

/**
 * 单个调度周期的约束
 */
@Value
@Builder(toBuilder = true)
public class DispatchConstraints {

    long cycleMs;

    /**
     * 备用比例，按容量保留，不参与放电
     */
    double reserveFraction;

    /**
     * 功率裕度系数 (0, 1]
     */
    @Builder.Default
    double rateMargin = 1.0;

    @Builder.Default
    double toleranceKw = 0.01;

    public double cycleHours() {
        return cycleMs / 3_600_000.0;
    }

    public DispatchConstraints tightened(double factor) {
        return toBuilder().rateMargin(rateMargin * factor).build();
    }
}
