package com.resilia.neurogrid.common.domain.entity;

import com.resilia.neurogrid.common.domain.enums.StorageType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 储能层级
 *
 * <p>按响应速度排序（rank 越小越快）。能量与遥测新鲜度只允许由储能库在提交调度计划
 * 或合并遥测时修改。</p>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class StorageTier {

    private final String id;
    private final StorageType type;

    /**
     * 响应排序，越小越先被调度
     */
    private final int responseRank;

    /**
     * 额定容量 kWh
     */
    private final double capacityKwh;

    /**
     * 最大充电功率 kW
     */
    private final double maxChargeKw;

    /**
     * 最大放电功率 kW
     */
    private final double maxDischargeKw;

    /**
     * 往返效率 (0, 1]
     */
    private final double roundTripEfficiency;

    /**
     * 当前储能量 kWh
     */
    private double energyKwh;

    /**
     * SOC 遥测是否新鲜
     */
    @Builder.Default
    private boolean telemetryFresh = true;

    @Builder.Default
    private long lastSocUpdateAt = 0L;

    /**
     * 荷电状态 0..1
     */
    public double stateOfCharge() {
        return capacityKwh > 0 ? energyKwh / capacityKwh : 0.0;
    }

    public double headroomKwh() {
        return Math.max(0.0, capacityKwh - energyKwh);
    }

    /**
     * 一个调度周期内可接受的充电功率上限
     *
     * @param cycleHours 周期长度（小时）
     * @param rateMargin 功率裕度系数 (0, 1]
     */
    public double chargeLimitKw(double cycleHours, double rateMargin) {
        double byRate = maxChargeKw * rateMargin;
        if (cycleHours <= 0) {
            return byRate;
        }
        double efficiency = roundTripEfficiency > 0 ? roundTripEfficiency : 1.0;
        double byEnergy = headroomKwh() / (cycleHours * efficiency);
        return Math.max(0.0, Math.min(byRate, byEnergy));
    }

    /**
     * 一个调度周期内可提供的放电功率上限（正数）
     *
     * @param reserveKwh 需保留的能量
     */
    public double dischargeLimitKw(double cycleHours, double rateMargin, double reserveKwh) {
        double byRate = maxDischargeKw * rateMargin;
        double usable = Math.max(0.0, energyKwh - Math.max(0.0, reserveKwh));
        if (cycleHours <= 0) {
            return usable > 0 ? byRate : 0.0;
        }
        return Math.max(0.0, Math.min(byRate, usable / cycleHours));
    }

    public void setEnergyKwh(double energyKwh) {
        this.energyKwh = Math.max(0.0, Math.min(capacityKwh, energyKwh));
    }

    public void markTelemetry(boolean fresh, long updatedAt) {
        this.telemetryFresh = fresh;
        if (fresh) {
            this.lastSocUpdateAt = updatedAt;
        }
    }

    public StorageTier copy() {
        return toBuilder().build();
    }
}
