package com.resilia.neurogrid.core.command;

import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 按连接状态过滤指令
 */
@Slf4j
@Component
public class CommandGate {

    public GateResult filter(List<GridCommand> commands, ConnectionState state) {
        List<GridCommand> allowed = new ArrayList<>();
        List<GridCommand> withheld = new ArrayList<>();
        for (GridCommand command : commands) {
            if (state.permits(command.category())) {
                allowed.add(command);
            } else {
                withheld.add(command);
            }
        }
        if (!withheld.isEmpty()) {
            log.debug("状态 {} 下扣留指令 {} 条", state, withheld.size());
        }
        return new GateResult(allowed, withheld);
    }

    public record GateResult(List<GridCommand> allowed, List<GridCommand> withheld) {
    }
}
