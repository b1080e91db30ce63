package com.resilia.neurogrid.core.command;

import com.resilia.neurogrid.common.domain.entity.TelemetrySample;
import com.resilia.neurogrid.common.domain.enums.CommandKind;
import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.telemetry.TelemetryWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 负荷削减规划
 *
 * <p>优先削减最不重要的负荷（优先级数字大者先削、可调比例大者先削），
 * 每个负荷最多削减其可调部分，关键负荷从不削减。</p>
 */
@Slf4j
@Component
public class LoadSheddingPlanner {

    private static final Comparator<NeuroGridProperties.LoadConfig> SHED_ORDER = Comparator
            .comparingInt(NeuroGridProperties.LoadConfig::getPriority).reversed()
            .thenComparing(Comparator.comparingDouble(NeuroGridProperties.LoadConfig::getFlexibility).reversed())
            .thenComparing(NeuroGridProperties.LoadConfig::getId);

    private final List<NeuroGridProperties.LoadConfig> loads;

    public LoadSheddingPlanner(NeuroGridProperties properties) {
        this.loads = new ArrayList<>(properties.getLoads());
        this.loads.sort(SHED_ORDER);
    }

    public ShedPlan plan(double deficitKw, TelemetryWindow window, long cycleTimestamp) {
        List<GridCommand> commands = new ArrayList<>();
        double remaining = deficitKw;
        for (NeuroGridProperties.LoadConfig load : loads) {
            if (remaining <= 0) {
                break;
            }
            if (load.isCritical() || load.getFlexibility() <= 0) {
                continue;
            }
            Optional<TelemetrySample> demand = window.latest(TelemetryQuantity.CONSUMPTION_KW, load.getId());
            if (demand.isEmpty() || demand.get().getValue() <= 0) {
                continue;
            }
            double sheddable = demand.get().getValue() * Math.min(1.0, load.getFlexibility());
            double shed = Math.min(remaining, sheddable);
            commands.add(GridCommand.builder()
                    .kind(CommandKind.LOAD_SHED)
                    .target(load.getId())
                    .value(shed)
                    .cycleTimestamp(cycleTimestamp)
                    .reason("unmet demand")
                    .build());
            remaining -= shed;
        }
        double uncovered = Math.max(0.0, remaining);
        if (uncovered > 0 && deficitKw > 0) {
            log.warn("负荷削减后仍有 {}kW 缺额", String.format("%.2f", uncovered));
        }
        return new ShedPlan(commands, deficitKw - uncovered, uncovered);
    }

    public record ShedPlan(List<GridCommand> commands, double shedKw, double uncoveredKw) {
    }
}
