package com.resilia.neurogrid.common.domain.entity;

import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 遥测样本，入库后不可变
 */
@Value
@Builder
@Jacksonized
public class TelemetrySample {

    /**
     * 数据来源（表计、传感器、储能单元ID、负荷ID等）
     */
    String source;

    TelemetryQuantity quantity;

    double value;

    /**
     * 采样时间戳（毫秒）
     */
    long timestamp;

    /**
     * 采样频率元数据（Hz），0 表示未知
     */
    double samplingRateHz;

    public static TelemetrySample of(String source, TelemetryQuantity quantity, double value, long timestamp) {
        return TelemetrySample.builder()
                .source(source)
                .quantity(quantity)
                .value(value)
                .timestamp(timestamp)
                .build();
    }

    /**
     * 序列键：同一数量、同一来源的样本构成一条时间序列
     */
    public String seriesKey() {
        return quantity.name() + "|" + source;
    }
}
