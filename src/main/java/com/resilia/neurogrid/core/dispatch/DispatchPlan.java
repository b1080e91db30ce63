package com.resilia.neurogrid.core.dispatch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 调度计划
 *
 * <p>不变式：netKw - Σflow = residualKw（在容差内）。residual 为正表示弃电，为负表示未满足负荷。</p>
 */
@Value
@Builder(toBuilder = true)
public class DispatchPlan {

    String planId;

    long timestamp;

    @Singular
    List<TierFlow> flows;

    double netKw;

    double residualKw;

    boolean unmetDemand;

    boolean curtailedSurplus;

    /**
     * 因 SOC 遥测过期被跳过的层级
     */
    @Singular
    List<String> skippedTiers;

    double rateMargin;

    public double totalFlowKw() {
        double total = 0.0;
        for (TierFlow flow : flows) {
            total += flow.getFlowKw();
        }
        return total;
    }

    public boolean isBalanced(double toleranceKw) {
        return Math.abs(netKw - totalFlowKw() - residualKw) <= toleranceKw;
    }
}
