package com.resilia.neurogrid.core.learning;

import com.resilia.neurogrid.core.config.NeuroGridProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按陈旧度加权的增量聚合
 *
 * <p>权重 = sampleCount · decay^staleness。输入先按来源节点排序再求和，
 * 因此结果与到达顺序无关。含非有限分量的增量被丢弃，其余分量裁剪到 maxDeltaMagnitude。</p>
 */
@Slf4j
@Component
public class StalenessWeightedAggregator {

    private final NeuroGridProperties.LearningConfig config;

    public StalenessWeightedAggregator(NeuroGridProperties properties) {
        this.config = properties.getLearning();
    }

    public AggregationResult aggregate(Collection<ModelDelta> deltas, long now) {
        List<String> discarded = new ArrayList<>();

        // 每个来源只保留最新一条
        Map<String, ModelDelta> latestByOrigin = new LinkedHashMap<>();
        for (ModelDelta delta : deltas) {
            if (delta == null) {
                continue;
            }
            if (!delta.isWellFormed()) {
                discarded.add(String.valueOf(delta.getOriginNodeId()));
                log.warn("丢弃格式无效的模型增量: origin={}", delta.getOriginNodeId());
                continue;
            }
            latestByOrigin.merge(delta.getOriginNodeId(), delta,
                    (a, b) -> a.getCreatedAt() >= b.getCreatedAt() ? a : b);
        }

        List<ModelDelta> ordered = new ArrayList<>(latestByOrigin.values());
        ordered.sort(Comparator.comparing(ModelDelta::getOriginNodeId));

        double[] weightedSum = new double[ForecastModel.PARAMETER_COUNT];
        double totalWeight = 0.0;
        List<String> contributors = new ArrayList<>();
        for (ModelDelta delta : ordered) {
            int staleness = delta.effectiveStaleness(now, config.getPeriodMs());
            if (staleness > config.getMaxStalenessRounds()) {
                discarded.add(delta.getOriginNodeId());
                log.debug("丢弃过期模型增量: origin={}, staleness={}", delta.getOriginNodeId(), staleness);
                continue;
            }
            double weight = delta.getSampleCount() * Math.pow(config.getStalenessDecay(), staleness);
            if (weight <= 0) {
                discarded.add(delta.getOriginNodeId());
                continue;
            }
            // 对端增量同样按单步上限裁剪
            double[] values = delta.getDeltas().clone();
            LocalModelTrainer.clip(values, config.getMaxDeltaMagnitude());
            for (int i = 0; i < weightedSum.length; i++) {
                weightedSum[i] += weight * values[i];
            }
            totalWeight += weight;
            contributors.add(delta.getOriginNodeId());
        }

        if (totalWeight <= 0) {
            return new AggregationResult(null, contributors, discarded);
        }
        for (int i = 0; i < weightedSum.length; i++) {
            weightedSum[i] /= totalWeight;
        }
        return new AggregationResult(weightedSum, contributors, discarded);
    }
}
