package com.resilia.neurogrid.common.exception;

import com.resilia.neurogrid.common.web.result.ResultCode;

/**
 * 控制核心错误分类
 *
 * <p>瞬时的本地问题（传感器过期、邻居不可达）在本地吸收，不上报运维；
 * 本地不可恢复故障总是上报，并且需要外部清除。</p>
 */
public enum GridErrorKind {

    SENSOR_STALE(ResultCode.SENSOR_STALE, true),
    PEER_UNREACHABLE(ResultCode.PEER_UNREACHABLE, true),
    CAPACITY_VIOLATION(ResultCode.CAPACITY_VIOLATION, false),
    COMMUNICATION_LOSS(ResultCode.COMMUNICATION_LOSS, false),
    IRRECOVERABLE_LOCAL_FAILURE(ResultCode.LOCAL_FAILURE, false),
    INVALID_TELEMETRY(ResultCode.TELEMETRY_INVALID, false),
    INVALID_OPERATION(ResultCode.STATE_INVALID, false);

    private final ResultCode resultCode;
    private final boolean transientCondition;

    GridErrorKind(ResultCode resultCode, boolean transientCondition) {
        this.resultCode = resultCode;
        this.transientCondition = transientCondition;
    }

    public ResultCode getResultCode() {
        return resultCode;
    }

    public boolean isTransientCondition() {
        return transientCondition;
    }
}
