package com.resilia.neurogrid.common.domain.enums;

import lombok.Getter;

/**
 * 微电网并网/孤岛状态枚举
 */
@Getter
public enum ConnectionState {

    GRID_CONNECTED("并网运行"),
    ISLAND_DETECTED("检测到孤岛"),
    ISLAND_STABLE("孤岛稳定运行"),
    RESYNCHRONIZING("重新同步中"),
    FAULT("故障");

    private final String description;

    ConnectionState(String description) {
        this.description = description;
    }

    // 判断是否与主网断开
    public boolean isIslanded() {
        return this == ISLAND_DETECTED || this == ISLAND_STABLE || this == RESYNCHRONIZING;
    }

    /**
     * 判断当前状态下是否允许发出该类别的指令。
     * <p>故障态只放行安全指令；非并网态扣留并网指令，直到重新同步确认完成。</p>
     */
    public boolean permits(CommandCategory category) {
        return switch (this) {
            case FAULT -> category == CommandCategory.SAFETY;
            case ISLAND_DETECTED, ISLAND_STABLE, RESYNCHRONIZING -> category != CommandCategory.GRID_TIE;
            case GRID_CONNECTED -> true;
        };
    }
}
