package com.resilia.neurogrid.core.command;

import com.resilia.neurogrid.common.domain.enums.CommandKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 幂等指令下发
 *
 * <p>按 kind + target 记录最后一次下发的值，值未变化的指令不重复下发。
 * 断路器的开、合互斥，下发其中一个会清除另一个的记录。</p>
 */
@Slf4j
@Component
public class CommandEmitter {

    private static final double VALUE_EPSILON = 1e-3;

    private final CommandSink sink;
    private final Map<String, GridCommand> lastIssued = new HashMap<>();
    private final AtomicLong emittedCount = new AtomicLong();
    private final AtomicLong suppressedCount = new AtomicLong();

    public CommandEmitter(CommandSink sink) {
        this.sink = sink;
    }

    /**
     * @return 实际下发的指令
     */
    public synchronized List<GridCommand> emit(List<GridCommand> commands) {
        List<GridCommand> sent = new ArrayList<>();
        for (GridCommand command : commands) {
            GridCommand previous = lastIssued.get(command.key());
            if (previous != null && Math.abs(previous.getValue() - command.getValue()) <= VALUE_EPSILON) {
                suppressedCount.incrementAndGet();
                continue;
            }
            sink.send(command);
            lastIssued.put(command.key(), command);
            clearOpposite(command);
            sent.add(command);
            emittedCount.incrementAndGet();
        }
        return sent;
    }

    private void clearOpposite(GridCommand command) {
        if (command.getKind() == CommandKind.BREAKER_OPEN) {
            lastIssued.remove(CommandKind.BREAKER_CLOSE.name() + "|" + command.getTarget());
        } else if (command.getKind() == CommandKind.BREAKER_CLOSE) {
            lastIssued.remove(CommandKind.BREAKER_OPEN.name() + "|" + command.getTarget());
        }
    }

    public synchronized void reset() {
        lastIssued.clear();
    }

    public long getEmittedCount() {
        return emittedCount.get();
    }

    public long getSuppressedCount() {
        return suppressedCount.get();
    }
}
