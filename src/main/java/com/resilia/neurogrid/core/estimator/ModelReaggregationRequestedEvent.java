package com.resilia.neurogrid.core.estimator;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 预测误差持续超限时发布，通知联邦学习提前聚合
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelReaggregationRequestedEvent {

    private String nodeId;

    /**
     * 当前误差 EWMA（kW）
     */
    private double errorEwmaKw;

    /**
     * 连续超限周期数
     */
    private int exceededCycles;

    private long modelVersion;

    private long requestedAt;
}
