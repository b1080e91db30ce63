package com.resilia.neurogrid.core.controller;

import lombok.Builder;
import lombok.Value;

/**
 * 当前功率平衡与储能概况
 */
@Value
@Builder
public class BalanceSnapshot {

    double productionKw;

    double consumptionKw;

    /**
     * 发电 - 负荷
     */
    double balanceKw;

    double storedEnergyKwh;

    double storageCapacityKwh;

    double storagePercent;
}
