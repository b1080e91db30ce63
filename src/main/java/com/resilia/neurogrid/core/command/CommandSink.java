package com.resilia.neurogrid.core.command;

/**
 * 物理执行层接口
 */
public interface CommandSink {

    void send(GridCommand command);
}
