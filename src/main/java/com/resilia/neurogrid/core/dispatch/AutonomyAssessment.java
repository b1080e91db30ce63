package com.resilia.neurogrid.core.dispatch;

import lombok.Builder;
import lombok.Value;

/**
 * 孤岛自治能力评估
 */
@Value
@Builder
public class AutonomyAssessment {

    boolean sustainable;

    /**
     * 评估时长内需要由储能补足的能量 kWh
     */
    double deficitEnergyKwh;

    double availableEnergyKwh;

    double peakDeficitKw;

    double availableDischargeKw;

    /**
     * 可用储能已耗尽
     */
    boolean storageExhausted;

    long horizonMs;

    /**
     * 无预测时的保守评估
     */
    public static AutonomyAssessment unknown(long horizonMs) {
        return AutonomyAssessment.builder()
                .sustainable(false)
                .storageExhausted(false)
                .horizonMs(horizonMs)
                .build();
    }
}
