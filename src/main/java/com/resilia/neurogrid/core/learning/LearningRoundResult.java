package com.resilia.neurogrid.core.learning;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一轮联邦学习的结果
 */
@Value
@Builder
public class LearningRoundResult {

    long round;

    long completedAt;

    /**
     * 本轮产生的本地增量，没有本地观测时为 null
     */
    ModelDelta localDelta;

    List<String> contributors;

    List<String> discarded;

    /**
     * 本轮生成的新模型，未更新时为 null
     */
    ForecastModel model;

    public boolean modelUpdated() {
        return model != null;
    }
}
