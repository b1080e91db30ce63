package com.resilia.neurogrid.core.islanding;

import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.command.GridCommand;

import java.util.List;

/**
 * 单次评估结果
 *
 * @param state      评估后的状态
 * @param transition 发生的状态转换，未转换为 null
 * @param commands   转换所需的指令
 */
public record TransitionResult(ConnectionState state, StateTransition transition, List<GridCommand> commands) {

    public static TransitionResult unchanged(ConnectionState state) {
        return new TransitionResult(state, null, List.of());
    }

    public boolean changed() {
        return transition != null;
    }
}
