package com.resilia.neurogrid.core.islanding;

import com.resilia.neurogrid.core.dispatch.AutonomyAssessment;
import lombok.Builder;
import lombok.Value;

/**
 * 状态机单次评估的输入
 */
@Value
@Builder
public class IslandingInputs {

    GridSignal gridSignal;

    AutonomyAssessment autonomy;

    /**
     * 控制周期连续超预算产生的通信劣化信号
     */
    boolean degradedCommunication;

    /**
     * 本地不可恢复故障：储能遥测丢失且存在未满足负荷
     */
    boolean localFailure;
}
