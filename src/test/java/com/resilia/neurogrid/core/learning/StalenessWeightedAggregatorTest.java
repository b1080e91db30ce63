package com.resilia.neurogrid.core.learning;

import com.resilia.neurogrid.core.config.NeuroGridProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StalenessWeightedAggregatorTest {

    private static final long NOW = 10_000_000L;

    private StalenessWeightedAggregator aggregator;

    @BeforeEach
    void setUp() {
        NeuroGridProperties properties = new NeuroGridProperties();
        properties.getLearning().setPeriodMs(60_000);
        properties.getLearning().setMaxStalenessRounds(5);
        properties.getLearning().setStalenessDecay(0.5);
        aggregator = new StalenessWeightedAggregator(properties);
    }

    @Test
    void resultDoesNotDependOnArrivalOrder() {
        List<ModelDelta> deltas = new ArrayList<>(List.of(
                delta("node-a", 10, 0, NOW, 0.013, -0.002, 0.007, 0.001, 0.0),
                delta("node-b", 20, 1, NOW, -0.031, 0.004, 0.011, -0.009, 0.01),
                delta("node-c", 5, 2, NOW, 0.047, 0.0, -0.023, 0.005, 0.0),
                delta("node-d", 7, 0, NOW - 120_000, 0.0021, 0.0033, -0.0044, 0.0055, 0.0)));
        double[] reference = aggregator.aggregate(deltas, NOW).delta();

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(deltas, random);
            AggregationResult result = aggregator.aggregate(deltas, NOW);
            assertArrayEquals(reference, result.delta());
            assertEquals(List.of("node-a", "node-b", "node-c", "node-d"), result.contributors());
        }
    }

    @Test
    void weightsBySampleCountAndStaleness() {
        AggregationResult result = aggregator.aggregate(List.of(
                delta("node-a", 10, 0, NOW, 0.01, 0, 0, 0, 0),
                delta("node-b", 20, 0, NOW, 0.04, 0, 0, 0, 0)), NOW);
        assertEquals((10 * 0.01 + 20 * 0.04) / 30, result.delta()[0], 1e-12);

        // 陈旧 1 轮的权重减半
        AggregationResult decayed = aggregator.aggregate(List.of(
                delta("node-a", 10, 0, NOW, 0.01, 0, 0, 0, 0),
                delta("node-b", 20, 1, NOW, 0.04, 0, 0, 0, 0)), NOW);
        assertEquals((10 * 0.01 + 10 * 0.04) / 20, decayed.delta()[0], 1e-12);
    }

    @Test
    void deltasBeyondStalenessBoundAreDiscarded() {
        AggregationResult result = aggregator.aggregate(List.of(
                delta("node-a", 10, 0, NOW, 0.01, 0, 0, 0, 0),
                delta("node-b", 10, 6, NOW, 0.05, 0, 0, 0, 0),
                delta("node-c", 10, 0, NOW - 7 * 60_000L, 0.05, 0, 0, 0, 0)), NOW);

        assertEquals(List.of("node-a"), result.contributors());
        assertTrue(result.discarded().containsAll(List.of("node-b", "node-c")));
        assertEquals(0.01, result.delta()[0], 1e-12);
    }

    @Test
    void onlyLatestDeltaPerOriginCounts() {
        AggregationResult result = aggregator.aggregate(List.of(
                delta("node-a", 10, 0, NOW - 1_000, 0.05, 0, 0, 0, 0),
                delta("node-a", 10, 0, NOW, 0.01, 0, 0, 0, 0)), NOW);

        assertEquals(List.of("node-a"), result.contributors());
        assertEquals(0.01, result.delta()[0], 1e-12);
    }

    @Test
    void malformedOrEmptyInputYieldsNoDelta() {
        ModelDelta wrongLength = ModelDelta.builder()
                .originNodeId("node-x").sampleCount(3).createdAt(NOW).deltas(new double[]{0.1}).build();

        AggregationResult result = aggregator.aggregate(List.of(wrongLength), NOW);

        assertFalse(result.hasDelta());
        assertEquals(List.of("node-x"), result.discarded());
        assertFalse(aggregator.aggregate(List.of(), NOW).hasDelta());
    }

    @Test
    void nonFinitePeerDeltaIsDiscarded() {
        AggregationResult result = aggregator.aggregate(List.of(
                delta("node-a", 10, 0, NOW, 0.01, 0, 0, 0, 0),
                delta("node-b", 10, 0, NOW, Double.NaN, 0, 0, 0, 0),
                delta("node-c", 10, 0, NOW, 0, Double.POSITIVE_INFINITY, 0, 0, 0)), NOW);

        assertEquals(List.of("node-a"), result.contributors());
        assertTrue(result.discarded().containsAll(List.of("node-b", "node-c")));
        for (double value : result.delta()) {
            assertTrue(Double.isFinite(value));
        }
    }

    @Test
    void oversizedPeerComponentsAreClippedBeforeWeighting() {
        ModelDelta huge = delta("node-b", 10, 0, NOW, 0, 1e6, 0, -1e6, 0);

        AggregationResult result = aggregator.aggregate(List.of(huge), NOW);

        assertEquals(0.05, result.delta()[ForecastModel.PRODUCTION_BIAS], 1e-12);
        assertEquals(-0.05, result.delta()[ForecastModel.CONSUMPTION_BIAS], 1e-12);
        // 原增量不被修改
        assertEquals(1e6, huge.getDeltas()[ForecastModel.PRODUCTION_BIAS]);

        ForecastModel next = ForecastModel.initial(0.1).apply(result.delta(), 0.3, NOW);
        assertEquals(100.05, next.predictProduction(100), 1e-9);
    }

        private static ModelDelta delta(String origin, int samples, int staleness, long createdAt, double... values) {
        return ModelDelta.builder()
                .originNodeId(origin)
                .baseVersion(1)
                .createdAt(createdAt)
                .staleness(staleness)
                .sampleCount(samples)
                .deltas(values)
                .build();
    }
}
