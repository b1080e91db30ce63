package com.resilia.neurogrid.common.domain.enums;

import lombok.Getter;

/**
 * 下发到物理执行层的指令类型
 */
@Getter
public enum CommandKind {

    STORAGE_SETPOINT(CommandCategory.DISPATCH, "储能充放电功率设定"),
    CURTAIL_PRODUCTION(CommandCategory.DISPATCH, "弃电/限发"),
    PEER_IMPORT_REQUEST(CommandCategory.DISPATCH, "向邻居微电网请求购电"),
    PEER_EXPORT_OFFER(CommandCategory.DISPATCH, "向邻居微电网提供余电"),
    LOAD_SHED(CommandCategory.SAFETY, "切除非关键负荷"),
    BREAKER_OPEN(CommandCategory.SAFETY, "断开并网断路器"),
    BREAKER_CLOSE(CommandCategory.GRID_TIE, "闭合并网断路器");

    private final CommandCategory category;
    private final String description;

    CommandKind(CommandCategory category, String description) {
        this.category = category;
        this.description = description;
    }
}
