package com.resilia.neurogrid.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 控制核心某一环节的健康，取自最近一次控制周期的节点快照
 *
 * <p>只有 gridConnection 会报告 DOWN（节点 FAULT）；其余组件最多 DEGRADED。</p>
 */
@Data
@Builder
public class ComponentHealth {

    private final String name;
    private final HealthStatus.Status status;
    private final String message;

    /**
     * 诊断字段，如当前状态、模型版本、不可达邻居列表、超预算次数
     */
    @Builder.Default
    private final Map<String, Object> details = new LinkedHashMap<>();

    /**
     * 快照生成时刻
     */
    @Builder.Default
    private final long checkedAt = Instant.now().toEpochMilli();

    public boolean isDown() {
        return status == HealthStatus.Status.DOWN;
    }
}
