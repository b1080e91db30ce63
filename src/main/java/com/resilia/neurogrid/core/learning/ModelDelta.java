package com.resilia.neurogrid.core.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 模型参数增量，只包含定长参数向量，从不包含原始遥测
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelDelta {

    String originNodeId;

    /**
     * 计算增量时所基于的本地模型版本
     */
    long baseVersion;

    long createdAt;

    /**
     * 发布时已经过的聚合轮数
     */
    int staleness;

    /**
     * 参与计算的本地观测数
     */
    int sampleCount;

    double[] deltas;

    /**
     * 有效陈旧度：自带的轮数加上自创建以来经过的轮数
     */
    public int effectiveStaleness(long now, long roundPeriodMs) {
        long elapsedRounds = roundPeriodMs > 0 ? Math.max(0L, now - createdAt) / roundPeriodMs : 0L;
        return (int) Math.min(Integer.MAX_VALUE, staleness + elapsedRounds);
    }

    /**
     * 来源、长度、样本数有效且每个分量都是有限数
     */
    @JsonIgnore
    public boolean isWellFormed() {
        if (originNodeId == null || deltas == null
                || deltas.length != ForecastModel.PARAMETER_COUNT || sampleCount <= 0) {
            return false;
        }
        for (double value : deltas) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
