package com.resilia.neurogrid.core.estimator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.resilia.neurogrid.core.learning.TrainingObservation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 供需预测窗口，每个控制周期重新生成
 */
@Value
@Builder
public class ForecastWindow {

    long generatedAt;

    long stepMs;

    long modelVersion;

    @Singular
    List<ForecastStep> steps;

    /**
     * 本周期的训练观测，发电或负荷不新鲜时为 null
     */
    @JsonIgnore
    TrainingObservation trainingObservation;

    public ForecastStep firstStep() {
        return steps.get(0);
    }

    public boolean isDegraded() {
        return steps.stream().anyMatch(ForecastStep::isDegraded);
    }

    public long spanMs() {
        return stepMs * steps.size();
    }
}
