package com.resilia.neurogrid.core.learning;

import lombok.Builder;
import lombok.Value;

/**
 * 一次训练观测：上一周期对当前时刻的原始预测与当前实测
 */
@Value
@Builder
public class TrainingObservation {

    double rawProductionKw;
    double actualProductionKw;
    double rawConsumptionKw;
    double actualConsumptionKw;
    long timestamp;
}
