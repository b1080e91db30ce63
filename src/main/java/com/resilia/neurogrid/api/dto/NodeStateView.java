package com.resilia.neurogrid.api.dto;

import com.resilia.neurogrid.common.domain.entity.StorageTier;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.controller.BalanceSnapshot;
import com.resilia.neurogrid.core.controller.CycleBudgetMonitor;
import com.resilia.neurogrid.core.controller.CycleReport;
import com.resilia.neurogrid.core.controller.NodeSnapshot;
import com.resilia.neurogrid.core.dispatch.AutonomyAssessment;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 节点状态视图
 */
@Value
@Builder
public class NodeStateView {

    String nodeId;
    long cycle;
    long timestamp;
    ConnectionState connectionState;
    String stateDescription;
    long modelVersion;
    BalanceSnapshot balance;
    AutonomyAssessment autonomy;
    List<StorageTier> storage;
    CycleBudgetMonitor.BudgetStats budget;
    CycleReport lastCycle;

    public static NodeStateView from(NodeSnapshot snapshot) {
        return NodeStateView.builder()
                .nodeId(snapshot.getNodeId())
                .cycle(snapshot.getCycle())
                .timestamp(snapshot.getTimestamp())
                .connectionState(snapshot.getConnectionState())
                .stateDescription(snapshot.getConnectionState().getDescription())
                .modelVersion(snapshot.getModelVersion())
                .balance(snapshot.getBalance())
                .autonomy(snapshot.getAutonomy())
                .storage(snapshot.getTiers())
                .budget(snapshot.getBudget())
                .lastCycle(snapshot.getLastCycle())
                .build();
    }
}
