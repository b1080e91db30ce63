package com.resilia.neurogrid.core.command;

import com.resilia.neurogrid.common.domain.enums.CommandCategory;
import com.resilia.neurogrid.common.domain.enums.CommandKind;
import lombok.Builder;
import lombok.Value;

/**
 * 下发到执行层的指令
 */
@Value
@Builder
public class GridCommand {

    /**
     * 并网点断路器的目标名
     */
    public static final String POINT_OF_COUPLING = "pcc";

    CommandKind kind;

    /**
     * 指令对象：储能层级ID、负荷ID、邻居节点ID 或 pcc
     */
    String target;

    double value;

    long cycleTimestamp;

    String reason;

    public CommandCategory category() {
        return kind.getCategory();
    }

    public String key() {
        return kind.name() + "|" + target;
    }

    public static GridCommand breakerOpen(long timestamp, String reason) {
        return GridCommand.builder()
                .kind(CommandKind.BREAKER_OPEN)
                .target(POINT_OF_COUPLING)
                .value(1.0)
                .cycleTimestamp(timestamp)
                .reason(reason)
                .build();
    }

    public static GridCommand breakerClose(long timestamp, String reason) {
        return GridCommand.builder()
                .kind(CommandKind.BREAKER_CLOSE)
                .target(POINT_OF_COUPLING)
                .value(1.0)
                .cycleTimestamp(timestamp)
                .reason(reason)
                .build();
    }
}
