package com.resilia.neurogrid.core.estimator;

import lombok.Builder;
import lombok.Value;

/**
 * 单个预测步
 */
@Value
@Builder
public class ForecastStep {

    long timestamp;

    double productionKw;

    double consumptionKw;

    /**
     * 净功率 = 发电 - 负荷，正值为盈余
     */
    double netKw;

    double lowerKw;

    double upperKw;

    /**
     * 是否使用了过期传感器的外推值
     */
    boolean degraded;
}
