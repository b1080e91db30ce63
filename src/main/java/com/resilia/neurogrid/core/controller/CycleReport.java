package com.resilia.neurogrid.core.controller;

import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.command.GridCommand;
import com.resilia.neurogrid.core.islanding.StateTransition;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 单个控制周期的执行报告
 */
@Value
@Builder
public class CycleReport {

    long cycle;

    long timestamp;

    ConnectionState state;

    StateTransition transition;

    boolean forecastAvailable;

    boolean dispatchPlanned;

    boolean planCommitted;

    /**
     * 本周期未调度的原因，正常时为 null
     */
    String dispatchSkippedReason;

    @Singular("emitted")
    List<GridCommand> emitted;

    @Singular("withheld")
    List<GridCommand> withheld;

    long durationMs;
}
