package com.resilia.neurogrid.monitor.health;

import com.resilia.neurogrid.common.domain.entity.MicrogridNode;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.controller.CycleBudgetMonitor;
import com.resilia.neurogrid.core.controller.LocalController;
import com.resilia.neurogrid.core.controller.NodeSnapshot;
import com.resilia.neurogrid.monitor.health.HealthStatus.Status;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 聚合节点级健康信息
 *
 * <p>FAULT 为 DOWN；孤岛运行、预测降级、邻居不可达或控制周期劣化为 DEGRADED。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemHealthService {

    private final LocalController localController;

    public HealthStatus getSystemHealth() {
        NodeSnapshot snapshot = localController.latestSnapshot();
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        components.put("gridConnection", buildConnectionHealth(snapshot));
        components.put("forecast", buildForecastHealth(snapshot));
        components.put("peers", buildPeerHealth(snapshot));
        components.put("controlCycle", buildCycleHealth(snapshot));

        Status overall = HealthStatus.aggregate(components.values());
        return HealthStatus.builder()
                .status(overall)
                .nodeId(snapshot.getNodeId())
                .components(components)
                .build();
    }

    private ComponentHealth buildConnectionHealth(NodeSnapshot snapshot) {
        ConnectionState state = snapshot.getConnectionState();
        Status status;
        if (state == ConnectionState.FAULT) {
            status = Status.DOWN;
        } else if (state.isIslanded()) {
            status = Status.DEGRADED;
        } else {
            status = Status.UP;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", state.name());
        details.put("description", state.getDescription());
        if (snapshot.getAutonomy() != null) {
            details.put("autonomySustainable", snapshot.getAutonomy().isSustainable());
            details.put("storageExhausted", snapshot.getAutonomy().isStorageExhausted());
        }
        return ComponentHealth.builder()
                .name("gridConnection")
                .status(status)
                .message(state == ConnectionState.FAULT ? "Fault requires operator clearance" : "Connection state")
                .details(details)
                .build();
    }

    private ComponentHealth buildForecastHealth(NodeSnapshot snapshot) {
        if (snapshot.getForecast() == null) {
            return ComponentHealth.builder()
                    .name("forecast")
                    .status(Status.UNKNOWN)
                    .message("No forecast available")
                    .build();
        }
        boolean degraded = snapshot.getForecast().isDegraded();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("modelVersion", snapshot.getModelVersion());
        details.put("steps", snapshot.getForecast().getSteps().size());
        details.put("degraded", degraded);
        return ComponentHealth.builder()
                .name("forecast")
                .status(degraded ? Status.DEGRADED : Status.UP)
                .message(degraded ? "Sensor dropout, using extrapolated values" : "Forecast healthy")
                .details(details)
                .build();
    }

    private ComponentHealth buildPeerHealth(NodeSnapshot snapshot) {
        List<MicrogridNode.PeerStatus> peers = snapshot.getPeers();
        List<String> unreachable = peers.stream()
                .filter(peer -> peer.getConsecutiveMisses() > 0 && !peer.isReachable())
                .map(MicrogridNode.PeerStatus::getPeerId)
                .collect(Collectors.toList());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalPeers", peers.size());
        details.put("unreachablePeers", unreachable);
        return ComponentHealth.builder()
                .name("peers")
                .status(unreachable.isEmpty() ? Status.UP : Status.DEGRADED)
                .message("Peer reachability snapshot")
                .details(details)
                .build();
    }

    private ComponentHealth buildCycleHealth(NodeSnapshot snapshot) {
        CycleBudgetMonitor.BudgetStats budget = snapshot.getBudget();
        if (budget == null) {
            return ComponentHealth.builder()
                    .name("controlCycle")
                    .status(Status.UNKNOWN)
                    .message("No cycle executed yet")
                    .build();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalCycles", budget.totalCycles());
        details.put("budgetMs", budget.budgetMs());
        details.put("lastDurationMs", budget.lastDurationMs());
        details.put("totalOverruns", budget.totalOverruns());
        return ComponentHealth.builder()
                .name("controlCycle")
                .status(budget.degraded() ? Status.DEGRADED : Status.UP)
                .message(budget.degraded() ? "Repeated cycle budget overruns" : "Within budget")
                .details(details)
                .build();
    }
}
