package com.resilia.neurogrid.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 微电网节点的健康快照
 *
 * <p>由并网状态、预测、邻居可达性和控制周期四个组件推导，/health 据此返回 200 或 503。</p>
 */
@Data
@Builder
public class HealthStatus {

    private final Status status;

    private final String nodeId;

    @Builder.Default
    private final long timestamp = Instant.now().toEpochMilli();

    /**
     * 组件名 -> 组件健康，按 gridConnection、forecast、peers、controlCycle 顺序
     */
    @Builder.Default
    private final Map<String, ComponentHealth> components = new LinkedHashMap<>();

    public enum Status {
        /** 并网运行且各组件正常 */
        UP,
        /** 节点处于 FAULT，只放行安全指令，需运维清除 */
        DOWN,
        /** 孤岛运行、预测外推、邻居不可达或控制周期持续超预算 */
        DEGRADED,
        /** 尚未完成首个控制周期或首次预测 */
        UNKNOWN
    }

    /**
     * 节点状态取最差的组件状态：DOWN > DEGRADED > UNKNOWN > UP
     */
    public static Status aggregate(Collection<ComponentHealth> componentHealths) {
        boolean hasDegraded = false;
        boolean hasUnknown = false;
        for (ComponentHealth component : componentHealths) {
            if (component == null) {
                continue;
            }
            if (component.isDown()) {
                return Status.DOWN;
            }
            if (component.getStatus() == Status.DEGRADED) {
                hasDegraded = true;
            } else if (component.getStatus() == Status.UNKNOWN) {
                hasUnknown = true;
            }
        }
        if (hasDegraded) {
            return Status.DEGRADED;
        }
        if (hasUnknown) {
            return Status.UNKNOWN;
        }
        return Status.UP;
    }
}
