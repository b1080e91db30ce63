package com.resilia.neurogrid.core.learning;

import lombok.Getter;

/**
 * 累积的本地训练步长，不可变
 */
@Getter
public final class TrainingAccumulator {

    private static final TrainingAccumulator EMPTY = new TrainingAccumulator(0, new double[ForecastModel.PARAMETER_COUNT], -1L);

    private final int count;
    private final double[] sums;
    private final long baseVersion;

    private TrainingAccumulator(int count, double[] sums, long baseVersion) {
        this.count = count;
        this.sums = sums;
        this.baseVersion = baseVersion;
    }

    public static TrainingAccumulator empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public TrainingAccumulator plus(double[] step, long modelVersion) {
        double[] next = sums.clone();
        for (int i = 0; i < next.length; i++) {
            next[i] += step[i];
        }
        return new TrainingAccumulator(count + 1, next, modelVersion);
    }

    public double[] mean() {
        double[] mean = new double[sums.length];
        if (count == 0) {
            return mean;
        }
        for (int i = 0; i < sums.length; i++) {
            mean[i] = sums[i] / count;
        }
        return mean;
    }
}
