package com.resilia.neurogrid.core.dispatch;

import com.resilia.neurogrid.common.domain.entity.StorageTier;
import com.resilia.neurogrid.common.exception.GridException;
import com.resilia.neurogrid.core.estimator.ForecastStep;
import com.resilia.neurogrid.core.estimator.ForecastWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 多层级储能调度
 *
 * <p>盈余时按响应顺序充电，剩余弃电；缺额时按响应顺序放电，剩余标记为未满足负荷。
 * 计划只针对预测窗口的第一步。</p>
 */
@Slf4j
@Component
public class StorageDispatcher {

    /**
     * 响应排序：rank 升序，效率高者优先，再按ID
     */
    public static final Comparator<StorageTier> RESPONSE_ORDER = Comparator
            .comparingInt(StorageTier::getResponseRank)
            .thenComparing(Comparator.comparingDouble(StorageTier::getRoundTripEfficiency).reversed())
            .thenComparing(StorageTier::getId);

    private static final double ENERGY_EPSILON_KWH = 1e-6;

    public DispatchPlan plan(ForecastWindow forecast, Collection<StorageTier> tiers, DispatchConstraints constraints) {
        ForecastStep step = forecast.firstStep();
        double net = step.getNetKw();
        double hours = constraints.cycleHours();

        DispatchPlan.DispatchPlanBuilder builder = DispatchPlan.builder()
                .planId(UUID.randomUUID().toString())
                .timestamp(step.getTimestamp())
                .netKw(net)
                .rateMargin(constraints.getRateMargin());

        double remaining = Math.abs(net);
        boolean surplus = net > 0;
        for (StorageTier tier : orderTiers(tiers)) {
            if (!tier.isTelemetryFresh()) {
                builder.skippedTier(tier.getId());
                continue;
            }
            double flow = 0.0;
            if (remaining > constraints.getToleranceKw()) {
                if (surplus) {
                    flow = Math.min(remaining, tier.chargeLimitKw(hours, constraints.getRateMargin()));
                } else {
                    double reserve = constraints.getReserveFraction() * tier.getCapacityKwh();
                    flow = -Math.min(remaining, tier.dischargeLimitKw(hours, constraints.getRateMargin(), reserve));
                }
                remaining -= Math.abs(flow);
            }
            builder.flow(TierFlow.builder()
                    .tierId(tier.getId())
                    .type(tier.getType())
                    .responseRank(tier.getResponseRank())
                    .flowKw(flow)
                    .build());
        }

        DispatchPlan draft = builder.build();
        double residual = net - draft.totalFlowKw();
        return draft.toBuilder()
                .residualKw(residual)
                .unmetDemand(residual < -constraints.getToleranceKw())
                .curtailedSurplus(residual > constraints.getToleranceKw())
                .build();
    }

    /**
     * 校验计划是否越过任何层级的物理边界
     *
     * @throws GridException CAPACITY_VIOLATION
     */
    public void validate(DispatchPlan plan, Collection<StorageTier> tiers) {
        validateWithin(plan, tiers, 0.0, 0.01);
    }

    public void validate(DispatchPlan plan, Collection<StorageTier> tiers, long cycleMs, double toleranceKw) {
        validateWithin(plan, tiers, cycleMs / 3_600_000.0, toleranceKw);
    }

    private void validateWithin(DispatchPlan plan, Collection<StorageTier> tiers, double hours, double toleranceKw) {
        Map<String, StorageTier> byId = new HashMap<>();
        for (StorageTier tier : tiers) {
            byId.put(tier.getId(), tier);
        }
        for (TierFlow flow : plan.getFlows()) {
            StorageTier tier = byId.get(flow.getTierId());
            if (tier == null) {
                throw GridException.capacityViolation(flow.getTierId(), "调度计划引用了未知储能层级: " + flow.getTierId());
            }
            double kw = flow.getFlowKw();
            if (kw > 0) {
                double limit = hours > 0 ? tier.chargeLimitKw(hours, 1.0) : tier.getMaxChargeKw();
                if (kw > limit + toleranceKw) {
                    throw GridException.capacityViolation(tier.getId(),
                            String.format("充电功率 %.3fkW 超过上限 %.3fkW", kw, limit));
                }
            } else if (kw < 0) {
                double limit = hours > 0 ? tier.dischargeLimitKw(hours, 1.0, 0.0) : tier.getMaxDischargeKw();
                if (-kw > limit + toleranceKw) {
                    throw GridException.capacityViolation(tier.getId(),
                            String.format("放电功率 %.3fkW 超过上限 %.3fkW", -kw, limit));
                }
            }
        }
        if (!plan.isBalanced(toleranceKw)) {
            throw GridException.capacityViolation(plan.getPlanId(),
                    String.format("功率不平衡: net=%.3f, Σflow=%.3f, residual=%.3f",
                            plan.getNetKw(), plan.totalFlowKw(), plan.getResidualKw()));
        }
    }

    /**
     * 评估仅靠储能能否维持预测负荷 horizonMs
     *
     * <p>预测窗口短于评估时长时，按窗口内平均缺额外推。</p>
     */
    public AutonomyAssessment assessAutonomy(ForecastWindow forecast, Collection<StorageTier> tiers, long horizonMs) {
        if (forecast == null || forecast.getSteps().isEmpty()) {
            return AutonomyAssessment.unknown(horizonMs);
        }
        double stepHours = forecast.getStepMs() / 3_600_000.0;
        double windowDeficitKwh = 0.0;
        double peakDeficitKw = 0.0;
        for (ForecastStep step : forecast.getSteps()) {
            // 取置信下界，按最坏情况评估
            double deficit = Math.max(0.0, -step.getLowerKw());
            windowDeficitKwh += deficit * stepHours;
            peakDeficitKw = Math.max(peakDeficitKw, deficit);
        }
        double windowHours = stepHours * forecast.getSteps().size();
        double horizonHours = horizonMs / 3_600_000.0;
        double deficitEnergy = windowHours > 0
                ? windowDeficitKwh * Math.max(1.0, horizonHours / windowHours)
                : 0.0;

        double availableEnergy = 0.0;
        double availableDischarge = 0.0;
        for (StorageTier tier : tiers) {
            if (!tier.isTelemetryFresh()) {
                continue;
            }
            availableEnergy += tier.getEnergyKwh();
            if (tier.getEnergyKwh() > ENERGY_EPSILON_KWH) {
                availableDischarge += tier.getMaxDischargeKw();
            }
        }

        boolean exhausted = availableEnergy <= ENERGY_EPSILON_KWH;
        boolean sustainable = availableEnergy + ENERGY_EPSILON_KWH >= deficitEnergy
                && availableDischarge + ENERGY_EPSILON_KWH >= peakDeficitKw;
        return AutonomyAssessment.builder()
                .sustainable(sustainable)
                .deficitEnergyKwh(deficitEnergy)
                .availableEnergyKwh(availableEnergy)
                .peakDeficitKw(peakDeficitKw)
                .availableDischargeKw(availableDischarge)
                .storageExhausted(exhausted && peakDeficitKw > 0)
                .horizonMs(horizonMs)
                .build();
    }

    public static List<StorageTier> orderTiers(Collection<StorageTier> tiers) {
        List<StorageTier> ordered = new ArrayList<>(tiers);
        ordered.sort(RESPONSE_ORDER);
        return ordered;
    }
}
