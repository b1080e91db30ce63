package com.resilia.neurogrid.core.islanding;

import com.resilia.neurogrid.common.domain.entity.MicrogridNode;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.common.exception.GridException;
import com.resilia.neurogrid.core.command.GridCommand;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.dispatch.AutonomyAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 并网/孤岛状态机
 *
 * <pre>
 * GRID_CONNECTED --主网异常持续 debounce--> ISLAND_DETECTED
 * ISLAND_DETECTED --自治可持续--> ISLAND_STABLE
 * ISLAND_DETECTED --不可持续且储能耗尽--> FAULT
 * ISLAND_STABLE --主网恢复且对齐--> RESYNCHRONIZING
 * RESYNCHRONIZING --对齐保持 resyncConfirmationMs--> GRID_CONNECTED
 * RESYNCHRONIZING --对齐失败--> ISLAND_STABLE
 * 任意状态 --本地不可恢复故障--> FAULT
 * FAULT --clearFault--> ISLAND_DETECTED
 * </pre>
 *
 * <p>FAULT 不会自行解除。</p>
 */
@Slf4j
@Component
public class IslandingStateMachine {

    private final NeuroGridProperties.IslandingConfig config;
    private final MicrogridNode node;
    private final Deque<StateTransition> history = new ArrayDeque<>();

    private ConnectionState state;
    private long firstEvaluatedAt = -1L;
    private long conditionAbnormalSince = -1L;
    private long alignedSince = -1L;

    public IslandingStateMachine(NeuroGridProperties properties, MicrogridNode node) {
        this.config = properties.getIslanding();
        this.node = node;
        this.state = node.getConnectionState();
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized TransitionResult evaluate(IslandingInputs inputs, long now) {
        if (firstEvaluatedAt < 0) {
            firstEvaluatedAt = now;
        }
        GridSignal signal = inputs.getGridSignal();

        if (state != ConnectionState.FAULT && inputs.isLocalFailure()) {
            List<GridCommand> commands = state == ConnectionState.GRID_CONNECTED
                    ? List.of(GridCommand.breakerOpen(now, "local failure"))
                    : List.of();
            return transition(ConnectionState.FAULT, now, "储能遥测丢失且存在未满足负荷", commands);
        }

        switch (state) {
            case GRID_CONNECTED:
                return evaluateConnected(signal, inputs.isDegradedCommunication(), now);
            case ISLAND_DETECTED:
                return evaluateDetected(inputs.getAutonomy(), now);
            case ISLAND_STABLE:
                if (isAligned(signal, now)) {
                    TransitionResult resync = transition(ConnectionState.RESYNCHRONIZING, now,
                            "主网恢复且电压/频率/相角对齐", List.of());
                    alignedSince = now;
                    return resync;
                }
                return TransitionResult.unchanged(state);
            case RESYNCHRONIZING:
                return evaluateResync(signal, now);
            case FAULT:
            default:
                return TransitionResult.unchanged(state);
        }
    }

    /**
     * 运维清除故障，进入 ISLAND_DETECTED 后需重新证明自治能力并重新同步
     *
     * @throws GridException INVALID_OPERATION，当前不在 FAULT
     */
    public synchronized StateTransition clearFault(String operator, String reason, long now) {
        if (state != ConnectionState.FAULT) {
            throw GridException.invalidOperation(node.getNodeId(), "当前状态 " + state + " 不是 FAULT, 无法清除故障");
        }
        log.warn("运维人员 {} 清除故障: {}", operator, reason);
        TransitionResult result = transition(ConnectionState.ISLAND_DETECTED, now,
                "operator " + operator + ": " + reason, List.of());
        return result.transition();
    }

    public synchronized List<StateTransition> history() {
        return new ArrayList<>(history);
    }

    private TransitionResult evaluateConnected(GridSignal signal, boolean degradedCommunication, long now) {
        long onset = abnormalOnset(signal, degradedCommunication, now);
        if (onset < 0 || now - onset < config.getDebounceMs()) {
            return TransitionResult.unchanged(state);
        }
        return transition(ConnectionState.ISLAND_DETECTED, now, describeAbnormal(signal, degradedCommunication, now),
                List.of(GridCommand.breakerOpen(now, "island detected")));
    }

    private TransitionResult evaluateDetected(AutonomyAssessment autonomy, long now) {
        if (autonomy == null) {
            return TransitionResult.unchanged(state);
        }
        if (autonomy.isSustainable()) {
            return transition(ConnectionState.ISLAND_STABLE, now, "储能可维持预测负荷", List.of());
        }
        if (autonomy.isStorageExhausted()) {
            return transition(ConnectionState.FAULT, now,
                    String.format("无法自治且储能耗尽: 缺额 %.2fkWh", autonomy.getDeficitEnergyKwh()), List.of());
        }
        return TransitionResult.unchanged(state);
    }

    private TransitionResult evaluateResync(GridSignal signal, long now) {
        if (!isAligned(signal, now)) {
            alignedSince = -1L;
            return transition(ConnectionState.ISLAND_STABLE, now, "重新同步期间对齐失败", List.of());
        }
        if (now - alignedSince >= config.getResyncConfirmationMs()) {
            alignedSince = -1L;
            return transition(ConnectionState.GRID_CONNECTED, now, "对齐保持确认时长, 合闸并网",
                    List.of(GridCommand.breakerClose(now, "resynchronized")));
        }
        return TransitionResult.unchanged(state);
    }

    /**
     * 主网异常开始的时刻，正常时返回 -1
     *
     * <p>心跳丢失的起点为最后一次心跳 + 超时；其他异常从首次观察到开始计时。</p>
     */
    private long abnormalOnset(GridSignal signal, boolean degradedCommunication, long now) {
        long heartbeatOnset = heartbeatLossOnset(signal, now);

        boolean conditionAbnormal = degradedCommunication
                || isOutOfTolerance(signal.getFrequencyHz(), config.getNominalFrequencyHz(), config.getFrequencyToleranceHz())
                || isOutOfTolerance(signal.getVoltagePu(), 1.0, config.getVoltageTolerancePu());
        if (conditionAbnormal) {
            if (conditionAbnormalSince < 0) {
                conditionAbnormalSince = now;
            }
        } else {
            conditionAbnormalSince = -1L;
        }

        if (heartbeatOnset >= 0 && conditionAbnormalSince >= 0) {
            return Math.min(heartbeatOnset, conditionAbnormalSince);
        }
        return heartbeatOnset >= 0 ? heartbeatOnset : conditionAbnormalSince;
    }

    private long heartbeatLossOnset(GridSignal signal, long now) {
        long reference = signal.getLastHeartbeatAt() > 0 ? signal.getLastHeartbeatAt() : firstEvaluatedAt;
        long onset = reference + config.getHeartbeatTimeoutMs();
        return now >= onset ? onset : -1L;
    }

    private boolean isAligned(GridSignal signal, long now) {
        if (signal == null || heartbeatLossOnset(signal, now) >= 0 || signal.getLastHeartbeatAt() <= 0) {
            return false;
        }
        if (signal.getFrequencyHz() == null || signal.getVoltagePu() == null || signal.getPhaseDeg() == null) {
            return false;
        }
        return !isOutOfTolerance(signal.getFrequencyHz(), config.getNominalFrequencyHz(), config.getFrequencyToleranceHz())
                && !isOutOfTolerance(signal.getVoltagePu(), 1.0, config.getVoltageTolerancePu())
                && Math.abs(signal.getPhaseDeg()) <= config.getPhaseToleranceDeg();
    }

    private static boolean isOutOfTolerance(Double value, double nominal, double tolerance) {
        return value != null && Math.abs(value - nominal) > tolerance;
    }

    private String describeAbnormal(GridSignal signal, boolean degradedCommunication, long now) {
        List<String> reasons = new ArrayList<>();
        if (heartbeatLossOnset(signal, now) >= 0) {
            reasons.add("主网心跳超时");
        }
        if (isOutOfTolerance(signal.getFrequencyHz(), config.getNominalFrequencyHz(), config.getFrequencyToleranceHz())) {
            reasons.add("频率越限 " + signal.getFrequencyHz() + "Hz");
        }
        if (isOutOfTolerance(signal.getVoltagePu(), 1.0, config.getVoltageTolerancePu())) {
            reasons.add("电压越限 " + signal.getVoltagePu() + "p.u.");
        }
        if (degradedCommunication) {
            reasons.add("控制周期连续超预算");
        }
        return String.join(", ", reasons);
    }

    private TransitionResult transition(ConnectionState target, long now, String reason, List<GridCommand> commands) {
        StateTransition transition = StateTransition.builder()
                .from(state)
                .to(target)
                .timestamp(now)
                .reason(reason)
                .build();
        if (target == ConnectionState.FAULT) {
            log.error("节点 {} 进入 FAULT: {} -> {}, 原因: {}", node.getNodeId(), state, target, reason);
        } else {
            log.info("节点 {} 状态转换: {} -> {}, 原因: {}", node.getNodeId(), state, target, reason);
        }
        state = target;
        node.setConnectionState(target);
        // 计时器只在所属状态内有效
        conditionAbnormalSince = -1L;
        alignedSince = -1L;
        history.addLast(transition);
        while (history.size() > Math.max(1, config.getHistorySize())) {
            history.removeFirst();
        }
        return new TransitionResult(target, transition, commands);
    }
}
