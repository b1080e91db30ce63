package com.resilia.neurogrid.core.dispatch;

import com.resilia.neurogrid.common.domain.entity.StorageTier;
import com.resilia.neurogrid.common.domain.enums.StorageType;
import com.resilia.neurogrid.common.exception.GridErrorKind;
import com.resilia.neurogrid.common.exception.GridException;
import com.resilia.neurogrid.core.estimator.ForecastStep;
import com.resilia.neurogrid.core.estimator.ForecastWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StorageDispatcherTest {

    private static final double EPS = 1e-6;

    private StorageDispatcher dispatcher;
    private DispatchConstraints constraints;

    @BeforeEach
    void setUp() {
        dispatcher = new StorageDispatcher();
        constraints = DispatchConstraints.builder()
                .cycleMs(1000)
                .reserveFraction(0.0)
                .build();
    }

    @Test
    void surplusChargesFastestTierAndLeavesNoResidual() {
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 50, 30, 30, 0.9);

        DispatchPlan plan = dispatcher.plan(forecast(100, 80), List.of(battery), constraints);

        assertEquals(1, plan.getFlows().size());
        assertEquals("battery", plan.getFlows().get(0).getTierId());
        assertEquals(20.0, plan.getFlows().get(0).getFlowKw(), EPS);
        assertEquals(0.0, plan.getResidualKw(), EPS);
        assertFalse(plan.isUnmetDemand());
        assertFalse(plan.isCurtailedSurplus());
        assertTrue(plan.isBalanced(constraints.getToleranceKw()));
    }

    @Test
    void deficitWalksTiersInResponseOrderAndReportsUnmetDemand() {
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 0, 50, 50, 0.95);
        StorageTier thermal = tier("thermal", StorageType.THERMAL, 3, 200, 100, 10, 10, 0.7);
        StorageTier hydrogen = tier("hydrogen", StorageType.HYDROGEN, 4, 1000, 500, 20, 20, 0.4);

        DispatchPlan plan = dispatcher.plan(forecast(10, 70), List.of(hydrogen, battery, thermal), constraints);

        List<TierFlow> active = new ArrayList<>();
        for (TierFlow flow : plan.getFlows()) {
            if (flow.getFlowKw() != 0.0) {
                active.add(flow);
            }
        }
        assertEquals(2, active.size());
        assertEquals("thermal", active.get(0).getTierId());
        assertEquals(-10.0, active.get(0).getFlowKw(), EPS);
        assertEquals("hydrogen", active.get(1).getTierId());
        assertEquals(-20.0, active.get(1).getFlowKw(), EPS);
        assertEquals(-30.0, plan.getResidualKw(), EPS);
        assertTrue(plan.isUnmetDemand());
        assertFalse(plan.isCurtailedSurplus());
    }

    @Test
    void surplusBeyondAllHeadroomIsCurtailed() {
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 50, 10, 10, 1.0);

        DispatchPlan plan = dispatcher.plan(forecast(60, 20), List.of(battery), constraints);

        assertEquals(10.0, plan.totalFlowKw(), EPS);
        assertEquals(30.0, plan.getResidualKw(), EPS);
        assertTrue(plan.isCurtailedSurplus());
    }

    @Test
    void equalRankPrefersHigherEfficiencyThenId() {
        StorageTier b = tier("b-pack", StorageType.BATTERY, 1, 100, 50, 5, 5, 0.9);
        StorageTier a = tier("a-pack", StorageType.BATTERY, 1, 100, 50, 5, 5, 0.9);
        StorageTier efficient = tier("z-pack", StorageType.BATTERY, 1, 100, 50, 5, 5, 0.98);

        List<StorageTier> ordered = StorageDispatcher.orderTiers(List.of(b, a, efficient));
        assertEquals(List.of("z-pack", "a-pack", "b-pack"),
                List.of(ordered.get(0).getId(), ordered.get(1).getId(), ordered.get(2).getId()));

        DispatchPlan plan = dispatcher.plan(forecast(7, 0), List.of(b, a, efficient), constraints);
        assertEquals(5.0, flowOf(plan, "z-pack"), EPS);
        assertEquals(2.0, flowOf(plan, "a-pack"), EPS);
        assertEquals(0.0, flowOf(plan, "b-pack"), EPS);
    }

    @Test
    void staleTierIsSkippedAndNextTierTakesOver() {
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 50, 50, 50, 0.9);
        battery.markTelemetry(false, 0L);
        StorageTier flywheel = tier("flywheel", StorageType.MECHANICAL, 2, 10, 5, 40, 40, 0.85);

        DispatchPlan plan = dispatcher.plan(forecast(0, 30), List.of(battery, flywheel), constraints);

        assertEquals(List.of("battery"), plan.getSkippedTiers());
        assertEquals(1, plan.getFlows().size());
        assertEquals(-30.0, flowOf(plan, "flywheel"), EPS);
        assertEquals(0.0, plan.getResidualKw(), EPS);
    }

    @Test
    void reserveFractionIsNeverDischarged() {
        // 1 小时周期，能量约束起主导作用
        DispatchConstraints hourly = DispatchConstraints.builder()
                .cycleMs(3_600_000)
                .reserveFraction(0.2)
                .build();
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 30, 50, 50, 0.9);

        DispatchPlan plan = dispatcher.plan(forecast(0, 40), List.of(battery), hourly);

        assertEquals(-10.0, flowOf(plan, "battery"), EPS);
        assertEquals(-30.0, plan.getResidualKw(), EPS);
        assertTrue(plan.isUnmetDemand());
    }

    @Test
    void randomScenariosNeverExceedTierLimits() {
        Random random = new Random(42);
        for (int run = 0; run < 200; run++) {
            List<StorageTier> tiers = new ArrayList<>();
            int count = 1 + random.nextInt(5);
            for (int i = 0; i < count; i++) {
                double capacity = 1 + random.nextDouble() * 200;
                tiers.add(tier("tier-" + i, StorageType.values()[i % StorageType.values().length],
                        1 + random.nextInt(5), capacity, random.nextDouble() * capacity,
                        random.nextDouble() * 60, random.nextDouble() * 60, 0.3 + random.nextDouble() * 0.7));
            }
            long cycleMs = 1000L * (1 + random.nextInt(3600));
            DispatchConstraints c = DispatchConstraints.builder()
                    .cycleMs(cycleMs)
                    .reserveFraction(random.nextDouble() * 0.3)
                    .build();
            double production = random.nextDouble() * 200;
            double consumption = random.nextDouble() * 200;

            DispatchPlan plan = dispatcher.plan(forecast(production, consumption), tiers, c);

            Map<String, StorageTier> byId = new HashMap<>();
            tiers.forEach(t -> byId.put(t.getId(), t));
            for (TierFlow flow : plan.getFlows()) {
                StorageTier t = byId.get(flow.getTierId());
                if (flow.getFlowKw() > 0) {
                    assertTrue(flow.getFlowKw() <= t.getMaxChargeKw() + EPS);
                    assertTrue(t.getEnergyKwh() + flow.getFlowKw() * c.cycleHours() * t.getRoundTripEfficiency()
                            <= t.getCapacityKwh() + EPS);
                } else if (flow.getFlowKw() < 0) {
                    assertTrue(-flow.getFlowKw() <= t.getMaxDischargeKw() + EPS);
                    double reserve = c.getReserveFraction() * t.getCapacityKwh();
                    assertTrue(t.getEnergyKwh() + flow.getFlowKw() * c.cycleHours() >= Math.min(reserve, t.getEnergyKwh()) - EPS);
                }
            }
            assertTrue(plan.isBalanced(c.getToleranceKw()));
            assertDoesNotThrow(() -> dispatcher.validate(plan, tiers, cycleMs, c.getToleranceKw()));
        }
    }

    @Test
    void validateRejectsFlowAboveRateLimit() {
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 50, 10, 10, 0.9);
        DispatchPlan plan = DispatchPlan.builder()
                .planId("manual")
                .netKw(25)
                .flow(TierFlow.builder().tierId("battery").type(StorageType.BATTERY).responseRank(1).flowKw(25).build())
                .residualKw(0)
                .build();

        GridException ex = assertThrows(GridException.class, () -> dispatcher.validate(plan, List.of(battery)));
        assertEquals(GridErrorKind.CAPACITY_VIOLATION, ex.getKind());
        assertEquals("battery", ex.getSubject());
    }

    @Test
    void validateRejectsUnknownTierAndImbalance() {
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 50, 10, 10, 0.9);
        DispatchPlan unknown = DispatchPlan.builder()
                .planId("unknown")
                .netKw(5)
                .flow(TierFlow.builder().tierId("ghost").flowKw(5).build())
                .build();
        assertThrows(GridException.class, () -> dispatcher.validate(unknown, List.of(battery)));

        DispatchPlan unbalanced = DispatchPlan.builder()
                .planId("unbalanced")
                .netKw(10)
                .flow(TierFlow.builder().tierId("battery").flowKw(5).build())
                .residualKw(0)
                .build();
        GridException ex = assertThrows(GridException.class, () -> dispatcher.validate(unbalanced, List.of(battery)));
        assertEquals(GridErrorKind.CAPACITY_VIOLATION, ex.getKind());
    }

    @Test
    void autonomyIsSustainableWhenStorageCoversHorizonDeficit() {
        StorageTier battery = tier("battery", StorageType.BATTERY, 1, 100, 50, 30, 30, 0.9);
        // 1 小时步长，缺额 20kW，1 小时评估需 20kWh
        ForecastWindow window = hourlyForecast(-20, 1);

        AutonomyAssessment ok = dispatcher.assessAutonomy(window, List.of(battery), 3_600_000);
        assertTrue(ok.isSustainable());
        assertEquals(20.0, ok.getDeficitEnergyKwh(), EPS);
        assertFalse(ok.isStorageExhausted());

        // 4 小时需 80kWh，超过可用能量
        AutonomyAssessment tooLong = dispatcher.assessAutonomy(window, List.of(battery), 4 * 3_600_000L);
        assertFalse(tooLong.isSustainable());
        assertEquals(80.0, tooLong.getDeficitEnergyKwh(), EPS);
    }

    @Test
    void autonomyReportsExhaustedStorage() {
        StorageTier empty = tier("battery", StorageType.BATTERY, 1, 100, 0, 30, 30, 0.9);

        AutonomyAssessment assessment = dispatcher.assessAutonomy(hourlyForecast(-5, 2), List.of(empty), 3_600_000);

        assertFalse(assessment.isSustainable());
        assertTrue(assessment.isStorageExhausted());
        assertFalse(dispatcher.assessAutonomy(null, List.of(empty), 1000).isSustainable());
    }

    private static double flowOf(DispatchPlan plan, String tierId) {
        return plan.getFlows().stream()
                .filter(f -> f.getTierId().equals(tierId))
                .mapToDouble(TierFlow::getFlowKw)
                .findFirst()
                .orElseThrow();
    }

    static StorageTier tier(String id, StorageType type, int rank, double capacityKwh, double energyKwh,
                            double maxChargeKw, double maxDischargeKw, double efficiency) {
        StorageTier tier = StorageTier.builder()
                .id(id)
                .type(type)
                .responseRank(rank)
                .capacityKwh(capacityKwh)
                .maxChargeKw(maxChargeKw)
                .maxDischargeKw(maxDischargeKw)
                .roundTripEfficiency(efficiency)
                .build();
        tier.setEnergyKwh(energyKwh);
        return tier;
    }

    static ForecastWindow forecast(double productionKw, double consumptionKw) {
        double net = productionKw - consumptionKw;
        return ForecastWindow.builder()
                .generatedAt(0)
                .stepMs(1000)
                .step(ForecastStep.builder()
                        .timestamp(1000)
                        .productionKw(productionKw)
                        .consumptionKw(consumptionKw)
                        .netKw(net)
                        .lowerKw(net - 1)
                        .upperKw(net + 1)
                        .build())
                .build();
    }

    private static ForecastWindow hourlyForecast(double netKw, int steps) {
        ForecastWindow.ForecastWindowBuilder builder = ForecastWindow.builder()
                .generatedAt(0)
                .stepMs(3_600_000);
        for (int k = 0; k < steps; k++) {
            builder.step(ForecastStep.builder()
                    .timestamp((k + 1) * 3_600_000L)
                    .netKw(netKw)
                    .lowerKw(netKw)
                    .upperKw(netKw)
                    .build());
        }
        return builder.build();
    }
}
