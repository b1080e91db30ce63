package com.resilia.neurogrid.core.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.Arrays;

/**
 * 预测与调度模型参数，不可变，每次聚合生成新版本
 *
 * <p>参数向量布局：[发电增益, 发电偏置, 负荷增益, 负荷偏置, 调度备用比例]</p>
 */
@Value
public class ForecastModel {

    public static final int PRODUCTION_GAIN = 0;
    public static final int PRODUCTION_BIAS = 1;
    public static final int CONSUMPTION_GAIN = 2;
    public static final int CONSUMPTION_BIAS = 3;
    public static final int RESERVE_FRACTION = 4;
    public static final int PARAMETER_COUNT = 5;

    private static final double MIN_GAIN = 0.1;
    private static final double MAX_GAIN = 10.0;

    long version;

    double[] parameters;

    long updatedAt;

    public ForecastModel(long version, double[] parameters, long updatedAt) {
        if (parameters == null || parameters.length != PARAMETER_COUNT) {
            throw new IllegalArgumentException("model parameter vector must have length " + PARAMETER_COUNT);
        }
        this.version = version;
        this.parameters = parameters.clone();
        this.updatedAt = updatedAt;
    }

    public static ForecastModel initial(double reserveFraction) {
        return new ForecastModel(0L, new double[]{1.0, 0.0, 1.0, 0.0, reserveFraction}, 0L);
    }

    public double[] getParameters() {
        return parameters.clone();
    }

    @JsonIgnore
    public double getProductionGain() {
        return parameters[PRODUCTION_GAIN];
    }

    @JsonIgnore
    public double getProductionBias() {
        return parameters[PRODUCTION_BIAS];
    }

    @JsonIgnore
    public double getConsumptionGain() {
        return parameters[CONSUMPTION_GAIN];
    }

    @JsonIgnore
    public double getConsumptionBias() {
        return parameters[CONSUMPTION_BIAS];
    }

    public double getReserveFraction() {
        return parameters[RESERVE_FRACTION];
    }

    public double predictProduction(double raw) {
        return Math.max(0.0, getProductionGain() * raw + getProductionBias());
    }

    public double predictConsumption(double raw) {
        return Math.max(0.0, getConsumptionGain() * raw + getConsumptionBias());
    }

    /**
     * 应用聚合后的增量，返回下一版本
     */
    public ForecastModel apply(double[] delta, double maxReserveFraction, long now) {
        if (delta == null || delta.length != PARAMETER_COUNT) {
            throw new IllegalArgumentException("delta vector must have length " + PARAMETER_COUNT);
        }
        double[] next = parameters.clone();
        for (int i = 0; i < PARAMETER_COUNT; i++) {
            if (!Double.isFinite(delta[i])) {
                throw new IllegalArgumentException("delta component " + i + " is not finite: " + delta[i]);
            }
            next[i] += delta[i];
        }
        next[PRODUCTION_GAIN] = clamp(next[PRODUCTION_GAIN], MIN_GAIN, MAX_GAIN);
        next[CONSUMPTION_GAIN] = clamp(next[CONSUMPTION_GAIN], MIN_GAIN, MAX_GAIN);
        next[RESERVE_FRACTION] = clamp(next[RESERVE_FRACTION], 0.0, maxReserveFraction);
        return new ForecastModel(version + 1, next, now);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public String toString() {
        return "ForecastModel(v" + version + ", " + Arrays.toString(parameters) + ")";
    }
}
