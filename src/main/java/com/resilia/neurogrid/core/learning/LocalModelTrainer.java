package com.resilia.neurogrid.core.learning;

import com.resilia.neurogrid.core.config.NeuroGridProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 本地训练器
 *
 * <p>控制线程在周期末调用 {@link #observe}，学习线程通过 {@link #takeSnapshot} 原子地取走累积值。</p>
 */
@Slf4j
@Component
public class LocalModelTrainer {

    private static final double NORMALIZATION_EPSILON = 1.0;

    private final NeuroGridProperties.LearningConfig config;
    private final AtomicReference<TrainingAccumulator> accumulator =
            new AtomicReference<>(TrainingAccumulator.empty());

    public LocalModelTrainer(NeuroGridProperties properties) {
        this.config = properties.getLearning();
    }

    /**
     * 记录一次观测，按归一化 LMS 计算参数步长
     *
     * @param unmetDemand 本周期是否出现未满足负荷，用于调整备用比例
     */
    public void observe(TrainingObservation observation, ForecastModel model, boolean unmetDemand) {
        double[] step = new double[ForecastModel.PARAMETER_COUNT];

        double prodRaw = observation.getRawProductionKw();
        double prodError = observation.getActualProductionKw()
                - (model.getProductionGain() * prodRaw + model.getProductionBias());
        step[ForecastModel.PRODUCTION_GAIN] = config.getLearningRate() * prodError * prodRaw
                / (prodRaw * prodRaw + NORMALIZATION_EPSILON);
        step[ForecastModel.PRODUCTION_BIAS] = config.getBiasLearningRate() * prodError;

        double consRaw = observation.getRawConsumptionKw();
        double consError = observation.getActualConsumptionKw()
                - (model.getConsumptionGain() * consRaw + model.getConsumptionBias());
        step[ForecastModel.CONSUMPTION_GAIN] = config.getLearningRate() * consError * consRaw
                / (consRaw * consRaw + NORMALIZATION_EPSILON);
        step[ForecastModel.CONSUMPTION_BIAS] = config.getBiasLearningRate() * consError;

        step[ForecastModel.RESERVE_FRACTION] = unmetDemand ? config.getReserveStep() : 0.0;

        clip(step, config.getMaxDeltaMagnitude());
        long version = model.getVersion();
        accumulator.updateAndGet(current -> current.plus(step, version));
    }

    public TrainingAccumulator takeSnapshot() {
        return accumulator.getAndSet(TrainingAccumulator.empty());
    }

    public int pendingObservations() {
        return accumulator.get().getCount();
    }

    /**
     * 由累积值生成待发布的增量；没有观测时返回 null
     */
    public ModelDelta toDelta(TrainingAccumulator snapshot, String nodeId, long now) {
        if (snapshot == null || snapshot.isEmpty()) {
            return null;
        }
        double[] mean = snapshot.mean();
        clip(mean, config.getMaxDeltaMagnitude());
        return ModelDelta.builder()
                .originNodeId(nodeId)
                .baseVersion(snapshot.getBaseVersion())
                .createdAt(now)
                .staleness(0)
                .sampleCount(snapshot.getCount())
                .deltas(mean)
                .build();
    }

    static void clip(double[] vector, double maxMagnitude) {
        for (int i = 0; i < vector.length; i++) {
            if (!Double.isFinite(vector[i])) {
                vector[i] = 0.0;
            } else if (vector[i] > maxMagnitude) {
                vector[i] = maxMagnitude;
            } else if (vector[i] < -maxMagnitude) {
                vector[i] = -maxMagnitude;
            }
        }
    }
}
