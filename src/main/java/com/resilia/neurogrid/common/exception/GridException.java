package com.resilia.neurogrid.common.exception;

import lombok.Getter;

/**
 * 电网控制异常
 */
@Getter
public class GridException extends BusinessException {

    private final GridErrorKind kind;

    /**
     * 相关对象：节点ID、储能层级ID、遥测来源等
     */
    private final String subject;

    public GridException(GridErrorKind kind, String message, String subject) {
        super(kind.getResultCode(), message);
        this.kind = kind;
        this.subject = subject;
    }

    public GridException(GridErrorKind kind, String message, String subject, Throwable cause) {
        super(kind.getResultCode(), message, cause);
        this.kind = kind;
        this.subject = subject;
    }

    // 创建传感器过期异常
    public static GridException sensorStale(String quantity) {
        return new GridException(GridErrorKind.SENSOR_STALE,
                "遥测量无可用样本且无历史外推值: " + quantity, quantity);
    }

    // 创建邻居不可达异常
    public static GridException peerUnreachable(String peerId, Throwable cause) {
        return new GridException(GridErrorKind.PEER_UNREACHABLE, "邻居节点不可达: " + peerId, peerId, cause);
    }

    // 创建容量越限异常
    public static GridException capacityViolation(String tierId, String message) {
        return new GridException(GridErrorKind.CAPACITY_VIOLATION, message, tierId);
    }

    // 创建遥测无效异常
    public static GridException invalidTelemetry(String source, String message) {
        return new GridException(GridErrorKind.INVALID_TELEMETRY, message, source);
    }

    // 创建非法操作异常
    public static GridException invalidOperation(String nodeId, String message) {
        return new GridException(GridErrorKind.INVALID_OPERATION, message, nodeId);
    }
}
