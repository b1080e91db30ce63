package com.resilia.neurogrid.common.domain.enums;

import lombok.Getter;

/**
 * 遥测量类型
 */
@Getter
public enum TelemetryQuantity {

    PRODUCTION_KW("kW", "发电功率", true),
    CONSUMPTION_KW("kW", "用电负荷", true),
    STORAGE_SOC("ratio", "储能荷电状态", false),
    GRID_HEARTBEAT("-", "主网心跳", false),
    GRID_FREQUENCY_HZ("Hz", "主网频率", false),
    GRID_VOLTAGE_PU("p.u.", "主网电压标幺值", false),
    GRID_PHASE_DEG("deg", "并网点相角差", false);

    private final String unit;
    private final String description;

    /**
     * 是否参与供需预测
     */
    private final boolean forecastTracked;

    TelemetryQuantity(String unit, String description, boolean forecastTracked) {
        this.unit = unit;
        this.description = description;
        this.forecastTracked = forecastTracked;
    }

    public boolean isGridSide() {
        return this == GRID_HEARTBEAT || this == GRID_FREQUENCY_HZ
                || this == GRID_VOLTAGE_PU || this == GRID_PHASE_DEG;
    }
}
