package com.resilia.neurogrid.core.estimator;

import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import com.resilia.neurogrid.common.exception.GridException;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.learning.ForecastModel;
import com.resilia.neurogrid.core.learning.TrainingObservation;
import com.resilia.neurogrid.core.telemetry.ForecastFeedUpdate;
import com.resilia.neurogrid.core.telemetry.TelemetryWindow;
import com.resilia.neurogrid.core.telemetry.WeatherPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 供需预测
 *
 * <p>只在控制线程调用。每个周期由遥测窗口和当前模型生成 horizonSteps 个预测步；
 * 传感器过期时沿用最后一次的外推值并标记降级，从不因过期而失败。</p>
 */
@Slf4j
@Component
public class SupplyDemandEstimator {

    private final NeuroGridProperties.EstimatorConfig config;
    private final String nodeId;
    private final ApplicationEventPublisher eventPublisher;
    private final RenewableProductionModel renewableModel;

    /**
     * 每个数量最后一次新鲜时的水平值与趋势
     */
    private final Map<TelemetryQuantity, QuantityState> lastKnown = new EnumMap<>(TelemetryQuantity.class);

    private ForecastWindow previous;
    private double[] previousRaw;
    private double errorEwmaKw = Double.NaN;
    private int exceededCycles;

    public SupplyDemandEstimator(NeuroGridProperties properties,
                                 ApplicationEventPublisher eventPublisher,
                                 RenewableProductionModel renewableModel) {
        this.config = properties.getEstimator();
        this.nodeId = properties.getNode().getId();
        this.eventPublisher = eventPublisher;
        this.renewableModel = renewableModel;
    }

    /**
     * 生成预测窗口
     *
     * @throws GridException SENSOR_STALE，当某个数量从未被观测且没有可外推的历史值
     */
    public ForecastWindow estimate(TelemetryWindow window, ForecastModel model,
                                   ForecastFeedUpdate feed, long now) {
        QuantityState production = resolve(window, TelemetryQuantity.PRODUCTION_KW, now);
        QuantityState consumption = resolve(window, TelemetryQuantity.CONSUMPTION_KW, now);
        boolean degraded = !production.fresh || !consumption.fresh;

        TrainingObservation observation = null;
        if (!degraded) {
            scoreError(production.level - consumption.level, model, now);
            observation = buildObservation(production, consumption, now);
        } else {
            previousRaw = null;
        }

        double sigmaBase = Math.max(config.getSigmaFloorKw(),
                Double.isNaN(errorEwmaKw) ? 0.0 : errorEwmaKw);
        if (degraded) {
            sigmaBase *= config.getDegradedWidening();
        }

        ForecastWindow.ForecastWindowBuilder builder = ForecastWindow.builder()
                .generatedAt(now)
                .stepMs(config.getStepMs())
                .modelVersion(model.getVersion())
                .trainingObservation(observation);

        for (int k = 0; k < config.getHorizonSteps(); k++) {
            long horizonMs = (k + 1) * config.getStepMs();
            long timestamp = now + horizonMs;

            double prodKw = model.predictProduction(production.extrapolate(timestamp));
            if (feed != null) {
                Optional<WeatherPoint> point = feed.closestPoint(timestamp, config.getFeedMaxGapMs());
                if (point.isPresent()) {
                    double feedKw = renewableModel.productionKw(point.get());
                    prodKw = (1.0 - config.getFeedWeight()) * prodKw + config.getFeedWeight() * feedKw;
                }
            }
            double consKw = model.predictConsumption(consumption.extrapolate(timestamp));
            double netKw = prodKw - consKw;
            double halfWidth = config.getConfidenceZ() * sigmaBase * Math.sqrt(k + 1);

            builder.step(ForecastStep.builder()
                    .timestamp(timestamp)
                    .productionKw(prodKw)
                    .consumptionKw(consKw)
                    .netKw(netKw)
                    .lowerKw(netKw - halfWidth)
                    .upperKw(netKw + halfWidth)
                    .degraded(degraded)
                    .build());
        }

        ForecastWindow forecast = builder.build();
        if (degraded) {
            log.debug("预测降级: production fresh={}, consumption fresh={}", production.fresh, consumption.fresh);
        }
        previous = forecast;
        return forecast;
    }

    public double getErrorEwmaKw() {
        return Double.isNaN(errorEwmaKw) ? 0.0 : errorEwmaKw;
    }

    public int getExceededCycles() {
        return exceededCycles;
    }

    private QuantityState resolve(TelemetryWindow window, TelemetryQuantity quantity, long now) {
        if (window.isFresh(quantity)) {
            QuantityState state = new QuantityState(window.sumLatest(quantity),
                    window.sumSlopePerMs(quantity), now, true);
            lastKnown.put(quantity, state);
            return state;
        }
        QuantityState known = lastKnown.get(quantity);
        if (known != null) {
            // 过期后保持最后一次新鲜时的水平值，不再沿趋势外推
            return new QuantityState(known.level, 0.0, now, false);
        }
        if (window.hasObserved(quantity)) {
            return new QuantityState(window.sumLatest(quantity), 0.0, now, false);
        }
        throw GridException.sensorStale(quantity.name());
    }

    // 用上一窗口第一个预测步对比当前实测
    private void scoreError(double actualNetKw, ForecastModel model, long now) {
        if (previous == null || previous.getSteps().isEmpty()) {
            return;
        }
        double error = Math.abs(actualNetKw - previous.firstStep().getNetKw());
        errorEwmaKw = Double.isNaN(errorEwmaKw)
                ? error
                : config.getEwmaAlpha() * error + (1.0 - config.getEwmaAlpha()) * errorEwmaKw;

        if (errorEwmaKw > config.getErrorThresholdKw()) {
            exceededCycles++;
            if (exceededCycles >= config.getSustainCycles()) {
                log.warn("预测误差持续超限: ewma={}kW, cycles={}, 请求重新聚合模型",
                        String.format("%.2f", errorEwmaKw), exceededCycles);
                eventPublisher.publishEvent(ModelReaggregationRequestedEvent.builder()
                        .nodeId(nodeId)
                        .errorEwmaKw(errorEwmaKw)
                        .exceededCycles(exceededCycles)
                        .modelVersion(model.getVersion())
                        .requestedAt(now)
                        .build());
                exceededCycles = 0;
            }
        } else {
            exceededCycles = 0;
        }
    }

    // 上一周期对当前时刻的原始预测与当前实测配对
    private TrainingObservation buildObservation(QuantityState production, QuantityState consumption, long now) {
        TrainingObservation observation = null;
        if (previousRaw != null) {
            observation = TrainingObservation.builder()
                    .rawProductionKw(previousRaw[0])
                    .actualProductionKw(production.level)
                    .rawConsumptionKw(previousRaw[1])
                    .actualConsumptionKw(consumption.level)
                    .timestamp(now)
                    .build();
        }
        long next = now + config.getStepMs();
        previousRaw = new double[]{production.extrapolate(next), consumption.extrapolate(next)};
        return observation;
    }

    private static final class QuantityState {
        private final double level;
        private final double slopePerMs;
        private final long at;
        private final boolean fresh;

        private QuantityState(double level, double slopePerMs, long at, boolean fresh) {
            this.level = level;
            this.slopePerMs = slopePerMs;
            this.at = at;
            this.fresh = fresh;
        }

        private double extrapolate(long timestamp) {
            return level + slopePerMs * (timestamp - at);
        }
    }
}
