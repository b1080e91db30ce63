package com.resilia.neurogrid.core.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 默认执行层：只记录收到的指令
 */
@Slf4j
@Component
public class LoggingCommandSink implements CommandSink {

    @Override
    public void send(GridCommand command) {
        log.info("下发指令 [{}] target={}, value={}, reason={}",
                command.getKind(), command.getTarget(),
                String.format("%.3f", command.getValue()), command.getReason());
    }
}
