package com.resilia.neurogrid.core.controller;

import com.resilia.neurogrid.common.domain.entity.MicrogridNode;
import com.resilia.neurogrid.common.domain.entity.StorageTier;
import com.resilia.neurogrid.common.domain.enums.CommandCategory;
import com.resilia.neurogrid.common.domain.enums.CommandKind;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.common.domain.enums.TelemetryQuantity;
import com.resilia.neurogrid.common.exception.GridErrorKind;
import com.resilia.neurogrid.common.exception.GridException;
import com.resilia.neurogrid.core.command.CommandEmitter;
import com.resilia.neurogrid.core.command.CommandGate;
import com.resilia.neurogrid.core.command.GridCommand;
import com.resilia.neurogrid.core.command.LoadSheddingPlanner;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.dispatch.AutonomyAssessment;
import com.resilia.neurogrid.core.dispatch.DispatchConstraints;
import com.resilia.neurogrid.core.dispatch.DispatchPlan;
import com.resilia.neurogrid.core.dispatch.StorageBank;
import com.resilia.neurogrid.core.dispatch.StorageDispatcher;
import com.resilia.neurogrid.core.dispatch.TierFlow;
import com.resilia.neurogrid.core.estimator.ForecastWindow;
import com.resilia.neurogrid.core.estimator.SupplyDemandEstimator;
import com.resilia.neurogrid.core.gossip.GossipRoundResult;
import com.resilia.neurogrid.core.gossip.PeerGossip;
import com.resilia.neurogrid.core.gossip.PeerSummary;
import com.resilia.neurogrid.core.islanding.GridSignal;
import com.resilia.neurogrid.core.islanding.IslandingInputs;
import com.resilia.neurogrid.core.islanding.IslandingStateMachine;
import com.resilia.neurogrid.core.islanding.TransitionResult;
import com.resilia.neurogrid.core.learning.FederatedLearningCoordinator;
import com.resilia.neurogrid.core.learning.ForecastModel;
import com.resilia.neurogrid.core.learning.LocalModelTrainer;
import com.resilia.neurogrid.core.telemetry.TelemetryIngest;
import com.resilia.neurogrid.core.telemetry.TelemetryWindow;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 本地控制器，每个周期执行一次完整的控制流程
 *
 * <p>唯一的控制线程持有遥测窗口、储能层级与连接状态。gossip 与联邦学习的结果通过原子引用交接，
 * 在周期开始时合并；周期结束时发布不可变的 {@link NodeSnapshot}。</p>
 */
@Slf4j
@Component
public class LocalController {

    private final NeuroGridProperties properties;
    private final MicrogridNode node;
    private final TelemetryIngest telemetryIngest;
    private final SupplyDemandEstimator estimator;
    private final StorageDispatcher dispatcher;
    private final StorageBank storageBank;
    private final IslandingStateMachine stateMachine;
    private final CommandGate commandGate;
    private final CommandEmitter commandEmitter;
    private final LoadSheddingPlanner loadSheddingPlanner;
    private final PeerGossip peerGossip;
    private final FederatedLearningCoordinator learningCoordinator;
    private final LocalModelTrainer trainer;
    private final ScheduledExecutorService scheduler;
    private final CycleBudgetMonitor budgetMonitor;

    private final AtomicReference<NodeSnapshot> snapshot;
    private final AtomicLong cycles = new AtomicLong();

    // 以下状态只属于控制线程
    private volatile ForecastModel model;
    private final Map<String, PeerSummary> peerView = new LinkedHashMap<>();

    private volatile ScheduledFuture<?> cycleTask;

    public LocalController(NeuroGridProperties properties,
                           MicrogridNode node,
                           TelemetryIngest telemetryIngest,
                           SupplyDemandEstimator estimator,
                           StorageDispatcher dispatcher,
                           StorageBank storageBank,
                           IslandingStateMachine stateMachine,
                           CommandGate commandGate,
                           CommandEmitter commandEmitter,
                           LoadSheddingPlanner loadSheddingPlanner,
                           PeerGossip peerGossip,
                           FederatedLearningCoordinator learningCoordinator,
                           LocalModelTrainer trainer,
                           @Qualifier("controlCycleScheduler") ScheduledExecutorService scheduler) {
        this.properties = properties;
        this.node = node;
        this.telemetryIngest = telemetryIngest;
        this.estimator = estimator;
        this.dispatcher = dispatcher;
        this.storageBank = storageBank;
        this.stateMachine = stateMachine;
        this.commandGate = commandGate;
        this.commandEmitter = commandEmitter;
        this.loadSheddingPlanner = loadSheddingPlanner;
        this.peerGossip = peerGossip;
        this.learningCoordinator = learningCoordinator;
        this.trainer = trainer;
        this.scheduler = scheduler;
        NeuroGridProperties.ControlConfig control = properties.getControl();
        this.budgetMonitor = new CycleBudgetMonitor(control.getBudgetMs(), control.getMaxBudgetOverruns());
        this.model = learningCoordinator.currentModel();
        this.snapshot = new AtomicReference<>(NodeSnapshot.initial(node.getNodeId(), node.getConnectionState()));
    }

    @PostConstruct
    public void start() {
        NeuroGridProperties.ControlConfig control = properties.getControl();
        if (!control.isEnabled()) {
            log.info("控制周期未启用");
            return;
        }
        cycleTask = scheduler.scheduleAtFixedRate(this::runScheduledCycle,
                control.getInitialDelayMs(), control.getPeriodMs(), TimeUnit.MILLISECONDS);
        log.info("控制周期已启动: node={}, period={}ms, budget={}ms",
                node.getNodeId(), control.getPeriodMs(), control.getBudgetMs());
    }

    @PreDestroy
    public void stop() {
        if (cycleTask != null) {
            cycleTask.cancel(false);
        }
    }

    private void runScheduledCycle() {
        try {
            runCycle(System.currentTimeMillis());
        } catch (Exception e) {
            log.error("控制周期执行失败, 下一周期继续", e);
        }
    }

    public CycleReport runCycle(long now) {
        long started = System.nanoTime();
        long cycle = cycles.incrementAndGet();
        CycleReport.CycleReportBuilder report = CycleReport.builder().cycle(cycle).timestamp(now);

        // 1. 合并待处理的模型与 gossip 结果
        mergePendingUpdates(now);

        // 2. 遥测与 SOC
        TelemetryWindow window = telemetryIngest.drain(now);
        storageBank.applySocTelemetry(window, now);

        // 3. 预测
        ForecastWindow forecast = forecast(window, now);
        report.forecastAvailable(forecast != null);

        // 4. 调度计划
        ConnectionState stateBefore = stateMachine.getState();
        DispatchConstraints constraints = constraintsFor(stateBefore);
        DispatchPlan plan = null;
        if (forecast == null) {
            report.dispatchSkippedReason("no forecast");
        } else {
            plan = planDispatch(forecast, constraints);
            if (plan == null) {
                report.dispatchSkippedReason("capacity violation");
            }
        }
        report.dispatchPlanned(plan != null);

        // 5. 自治评估与孤岛状态机
        AutonomyAssessment autonomy = dispatcher.assessAutonomy(forecast, storageBank.liveTiers(),
                properties.getDispatch().getAutonomyHorizonMs());
        boolean localFailure = plan != null && plan.isUnmetDemand() && storageBank.hasStaleTelemetry();
        TransitionResult transition = stateMachine.evaluate(IslandingInputs.builder()
                .gridSignal(GridSignal.from(window))
                .autonomy(autonomy)
                .degradedCommunication(budgetMonitor.isDegraded())
                .localFailure(localFailure)
                .build(), now);
        ConnectionState state = transition.state();
        report.state(state).transition(transition.transition());

        // 6. 指令与残差处理
        List<GridCommand> commands = new ArrayList<>(transition.commands());
        if (plan != null) {
            commands.addAll(storageCommands(plan, now));
            commands.addAll(residualCommands(plan, window, now));
        }

        // 7. 按状态门控并幂等下发
        CommandGate.GateResult gated = commandGate.filter(commands, state);
        report.emitted(commandEmitter.emit(gated.allowed()));
        report.withheld(gated.withheld());

        // 8. 提交计划并记录训练观测
        boolean committed = false;
        if (plan != null && state.permits(CommandCategory.DISPATCH)) {
            committed = storageBank.commit(plan, constraints.getCycleMs());
        }
        report.planCommitted(committed);
        if (forecast != null && forecast.getTrainingObservation() != null) {
            trainer.observe(forecast.getTrainingObservation(), model, plan != null && plan.isUnmetDemand());
        }

        // 9. 周期耗时
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        budgetMonitor.record(durationMs);
        CycleReport cycleReport = report.durationMs(durationMs).build();

        // 10. 发布快照
        publishSnapshot(cycle, now, state, forecast, plan, autonomy, window, cycleReport);
        return cycleReport;
    }

    private void mergePendingUpdates(long now) {
        ForecastModel adopted = learningCoordinator.takePendingModel();
        if (adopted != null) {
            log.info("采用新模型 v{} (原 v{})", adopted.getVersion(), model.getVersion());
            model = adopted;
        }
        GossipRoundResult round = peerGossip.takeRoundResult();
        if (round != null) {
            for (PeerSummary summary : round.getReachables()) {
                peerView.put(summary.getNodeId(), summary);
                node.recordPeerContact(summary.getNodeId(), true, summary.getTimestamp());
            }
            for (String peerId : round.getUnreachables()) {
                peerView.remove(peerId);
                node.recordPeerContact(peerId, false, now);
            }
        }
        // 超过 TTL 的摘要视为不可达
        long ttl = properties.getGossip().getPeerTtlMs();
        peerView.values().removeIf(summary -> now - summary.getTimestamp() > ttl);
    }

    private ForecastWindow forecast(TelemetryWindow window, long now) {
        try {
            return estimator.estimate(window, model, telemetryIngest.latestForecastFeed(), now);
        } catch (GridException e) {
            if (e.getKind() != GridErrorKind.SENSOR_STALE) {
                throw e;
            }
            log.debug("本周期跳过调度: {}", e.getMessage());
            return null;
        }
    }

    private DispatchConstraints constraintsFor(ConnectionState state) {
        NeuroGridProperties.DispatchConfig dispatch = properties.getDispatch();
        return DispatchConstraints.builder()
                .cycleMs(properties.getControl().getPeriodMs())
                .reserveFraction(state == ConnectionState.GRID_CONNECTED ? model.getReserveFraction() : 0.0)
                .rateMargin(dispatch.getRateMargin())
                .toleranceKw(dispatch.getToleranceKw())
                .build();
    }

    /**
     * 计划并校验；越限时收紧裕度重算一次，仍越限则本周期不调度
     */
    private DispatchPlan planDispatch(ForecastWindow forecast, DispatchConstraints constraints) {
        DispatchPlan plan = dispatcher.plan(forecast, storageBank.liveTiers(), constraints);
        try {
            dispatcher.validate(plan, storageBank.liveTiers(), constraints.getCycleMs(), constraints.getToleranceKw());
            return plan;
        } catch (GridException first) {
            log.error("调度计划越限, 收紧裕度重算: {}", first.getMessage());
        }
        DispatchConstraints tightened = constraints.tightened(properties.getDispatch().getTightenFactor());
        DispatchPlan retry = dispatcher.plan(forecast, storageBank.liveTiers(), tightened);
        try {
            dispatcher.validate(retry, storageBank.liveTiers(), tightened.getCycleMs(), tightened.getToleranceKw());
            return retry;
        } catch (GridException second) {
            log.error("收紧裕度后仍越限, 本周期不下发调度指令: {}", second.getMessage());
            return null;
        }
    }

    private List<GridCommand> storageCommands(DispatchPlan plan, long now) {
        List<GridCommand> commands = new ArrayList<>(plan.getFlows().size());
        for (TierFlow flow : plan.getFlows()) {
            commands.add(GridCommand.builder()
                    .kind(CommandKind.STORAGE_SETPOINT)
                    .target(flow.getTierId())
                    .value(flow.getFlowKw())
                    .cycleTimestamp(now)
                    .reason("dispatch " + plan.getPlanId())
                    .build());
        }
        return commands;
    }

    /**
     * 未满足负荷：先向有盈余的邻居请求，再削减负荷；弃电：先向有缺额的邻居提供，剩余限发
     */
    private List<GridCommand> residualCommands(DispatchPlan plan, TelemetryWindow window, long now) {
        double tolerance = properties.getDispatch().getToleranceKw();
        List<GridCommand> commands = new ArrayList<>();
        if (plan.isUnmetDemand()) {
            double remaining = -plan.getResidualKw();
            List<PeerSummary> donors = reachablePeers();
            donors.removeIf(peer -> !peer.hasSurplus(tolerance));
            donors.sort(Comparator.comparingDouble(PeerSummary::getResidualKw).reversed()
                    .thenComparing(PeerSummary::getNodeId));
            for (PeerSummary donor : donors) {
                if (remaining <= tolerance) {
                    break;
                }
                double request = Math.min(remaining, donor.getResidualKw());
                commands.add(peerCommand(CommandKind.PEER_IMPORT_REQUEST, donor.getNodeId(), request, now));
                remaining -= request;
            }
            if (remaining > tolerance) {
                commands.addAll(loadSheddingPlanner.plan(remaining, window, now).commands());
            }
        } else if (plan.isCurtailedSurplus()) {
            double remaining = plan.getResidualKw();
            List<PeerSummary> receivers = reachablePeers();
            receivers.removeIf(peer -> !peer.hasDeficit(tolerance));
            receivers.sort(Comparator.comparingDouble(PeerSummary::getResidualKw)
                    .thenComparing(PeerSummary::getNodeId));
            for (PeerSummary receiver : receivers) {
                if (remaining <= tolerance) {
                    break;
                }
                double offer = Math.min(remaining, -receiver.getResidualKw());
                commands.add(peerCommand(CommandKind.PEER_EXPORT_OFFER, receiver.getNodeId(), offer, now));
                remaining -= offer;
            }
            if (remaining > tolerance) {
                commands.add(GridCommand.builder()
                        .kind(CommandKind.CURTAIL_PRODUCTION)
                        .target(node.getNodeId())
                        .value(remaining)
                        .cycleTimestamp(now)
                        .reason("surplus beyond storage headroom")
                        .build());
            }
        }
        return commands;
    }

    private List<PeerSummary> reachablePeers() {
        List<PeerSummary> peers = new ArrayList<>();
        for (PeerSummary summary : peerView.values()) {
            if (summary.getConnectionState() != ConnectionState.FAULT) {
                peers.add(summary);
            }
        }
        return peers;
    }

    private GridCommand peerCommand(CommandKind kind, String peerId, double kw, long now) {
        return GridCommand.builder()
                .kind(kind)
                .target(peerId)
                .value(kw)
                .cycleTimestamp(now)
                .reason("peer exchange")
                .build();
    }

    private void publishSnapshot(long cycle, long now, ConnectionState state, ForecastWindow forecast,
                                 DispatchPlan plan, AutonomyAssessment autonomy, TelemetryWindow window,
                                 CycleReport report) {
        List<StorageTier> tiers = storageBank.snapshot();
        double production = window.sumLatest(TelemetryQuantity.PRODUCTION_KW);
        double consumption = window.sumLatest(TelemetryQuantity.CONSUMPTION_KW);
        double stored = storageBank.totalEnergyKwh();
        double capacity = storageBank.totalCapacityKwh();
        BalanceSnapshot balance = BalanceSnapshot.builder()
                .productionKw(production)
                .consumptionKw(consumption)
                .balanceKw(production - consumption)
                .storedEnergyKwh(stored)
                .storageCapacityKwh(capacity)
                .storagePercent(capacity > 0 ? stored / capacity * 100.0 : 0.0)
                .build();

        NodeSnapshot next = NodeSnapshot.builder()
                .nodeId(node.getNodeId())
                .cycle(cycle)
                .timestamp(now)
                .connectionState(state)
                .modelVersion(model.getVersion())
                .forecast(forecast)
                .plan(plan)
                .autonomy(autonomy)
                .balance(balance)
                .tiers(tiers)
                .peers(node.peerStatusSnapshot())
                .budget(budgetMonitor.snapshot())
                .lastCycle(report)
                .build();
        snapshot.set(next);
        peerGossip.updateLocalState(state, next.residualKw());
    }

    public NodeSnapshot latestSnapshot() {
        return snapshot.get();
    }

    public CycleBudgetMonitor getBudgetMonitor() {
        return budgetMonitor;
    }

    public ForecastModel activeModel() {
        return model;
    }
}
