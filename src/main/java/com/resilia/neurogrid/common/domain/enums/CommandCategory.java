package com.resilia.neurogrid.common.domain.enums;

/**
 * 指令类别，用于按连接状态门控
 */
public enum CommandCategory {
    SAFETY,
    DISPATCH,
    GRID_TIE
}
