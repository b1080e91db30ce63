package com.resilia.neurogrid.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_NOT_FOUND(1001, "数据不存在"),

    // 电网控制相关错误
    SENSOR_STALE(2000, "传感器数据过期"),
    PEER_UNREACHABLE(2001, "邻居节点不可达"),
    CAPACITY_VIOLATION(2002, "调度计划超出储能约束"),
    COMMUNICATION_LOSS(2003, "主网通信丢失"),
    LOCAL_FAILURE(2004, "本地不可恢复故障"),
    TELEMETRY_INVALID(2005, "遥测数据无效"),
    STATE_INVALID(2006, "当前状态不允许该操作"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
