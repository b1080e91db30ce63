package com.resilia.neurogrid.core.controller;

import com.resilia.neurogrid.common.domain.entity.MicrogridNode;
import com.resilia.neurogrid.common.domain.entity.StorageTier;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.dispatch.AutonomyAssessment;
import com.resilia.neurogrid.core.dispatch.DispatchPlan;
import com.resilia.neurogrid.core.estimator.ForecastWindow;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 控制周期末发布的不可变节点快照，供 gossip、学习与接口读取
 */
@Value
@Builder
public class NodeSnapshot {

    String nodeId;

    long cycle;

    long timestamp;

    ConnectionState connectionState;

    long modelVersion;

    ForecastWindow forecast;

    DispatchPlan plan;

    AutonomyAssessment autonomy;

    BalanceSnapshot balance;

    List<StorageTier> tiers;

    List<MicrogridNode.PeerStatus> peers;

    CycleBudgetMonitor.BudgetStats budget;

    CycleReport lastCycle;

    public double residualKw() {
        return plan != null ? plan.getResidualKw() : 0.0;
    }

    public static NodeSnapshot initial(String nodeId, ConnectionState state) {
        return NodeSnapshot.builder()
                .nodeId(nodeId)
                .connectionState(state)
                .tiers(List.of())
                .peers(List.of())
                .build();
    }
}
