package com.resilia.neurogrid.core.learning;

import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.estimator.ModelReaggregationRequestedEvent;
import com.resilia.neurogrid.core.gossip.PeerGossip;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 联邦学习协调
 *
 * <p>按 learning.periodMs 周期（或收到重新聚合请求时提前）在学习线程上运行：
 * 取走控制周期边界处的训练累积，生成本地增量，合并邻居增量，按陈旧度加权聚合，
 * 生成新模型交给控制周期在下一周期开始时采用。</p>
 */
@Slf4j
@Component
public class FederatedLearningCoordinator {

    private final NeuroGridProperties.LearningConfig config;
    private final String nodeId;
    private final LocalModelTrainer trainer;
    private final StalenessWeightedAggregator aggregator;
    private final PeerGossip peerGossip;
    private final ScheduledExecutorService scheduler;
    private final Executor learningExecutor;

    private final AtomicReference<ForecastModel> latestModel;
    private final AtomicReference<ForecastModel> pendingModel = new AtomicReference<>();
    private final AtomicLong rounds = new AtomicLong();
    private final Map<String, Long> appliedDeltas = new HashMap<>();

    private volatile ScheduledFuture<?> roundTask;

    @Autowired
    public FederatedLearningCoordinator(NeuroGridProperties properties,
                                        LocalModelTrainer trainer,
                                        StalenessWeightedAggregator aggregator,
                                        PeerGossip peerGossip,
                                        @Qualifier("backgroundScheduler") ScheduledExecutorService scheduler,
                                        @Qualifier("learningExecutor") Executor learningExecutor) {
        this.config = properties.getLearning();
        this.nodeId = properties.getNode().getId();
        this.trainer = trainer;
        this.aggregator = aggregator;
        this.peerGossip = peerGossip;
        this.scheduler = scheduler;
        this.learningExecutor = learningExecutor;
        this.latestModel = new AtomicReference<>(ForecastModel.initial(config.getInitialReserveFraction()));
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("联邦学习未启用");
            return;
        }
        roundTask = scheduler.scheduleWithFixedDelay(this::submitRound,
                config.getPeriodMs(), config.getPeriodMs(), TimeUnit.MILLISECONDS);
        log.info("联邦学习已启动: period={}ms, maxStaleness={}", config.getPeriodMs(), config.getMaxStalenessRounds());
    }

    @PreDestroy
    public void stop() {
        if (roundTask != null) {
            roundTask.cancel(false);
        }
    }

    @EventListener
    public void onReaggregationRequested(ModelReaggregationRequestedEvent event) {
        if (!config.isEnabled()) {
            return;
        }
        log.info("收到重新聚合请求: node={}, ewma={}kW, cycles={}", event.getNodeId(),
                String.format("%.2f", event.getErrorEwmaKw()), event.getExceededCycles());
        submitRound();
    }

    private void submitRound() {
        try {
            learningExecutor.execute(() -> {
                try {
                    runRound(System.currentTimeMillis());
                } catch (Exception e) {
                    log.error("联邦学习轮次执行失败", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("学习线程繁忙, 跳过本次聚合请求");
        }
    }

    public synchronized LearningRoundResult runRound(long now) {
        long round = rounds.incrementAndGet();
        TrainingAccumulator snapshot = trainer.takeSnapshot();
        ModelDelta localDelta = trainer.toDelta(snapshot, nodeId, now);

        // 同一来源的同一增量只聚合一次
        List<ModelDelta> inputs = new ArrayList<>();
        for (ModelDelta delta : peerGossip.peerModelDeltas()) {
            Long applied = appliedDeltas.get(delta.getOriginNodeId());
            if (applied == null || delta.getCreatedAt() > applied) {
                inputs.add(delta);
            }
        }
        if (localDelta != null) {
            inputs.add(localDelta);
        }
        AggregationResult aggregation = aggregator.aggregate(inputs, now);

        for (ModelDelta delta : inputs) {
            if (aggregation.contributors().contains(delta.getOriginNodeId())) {
                appliedDeltas.merge(delta.getOriginNodeId(), delta.getCreatedAt(), Math::max);
            }
        }

        ForecastModel updated = null;
        if (aggregation.hasDelta()) {
            updated = latestModel.get().apply(aggregation.delta(), config.getMaxReserveFraction(), now);
            latestModel.set(updated);
            pendingModel.set(updated);
            log.info("模型已更新到 v{}: contributors={}, discarded={}",
                    updated.getVersion(), aggregation.contributors(), aggregation.discarded());
        } else if (!aggregation.discarded().isEmpty()) {
            log.debug("本轮无有效增量, 丢弃: {}", aggregation.discarded());
        }

        if (localDelta != null) {
            peerGossip.publishLocalDelta(localDelta);
        }

        return LearningRoundResult.builder()
                .round(round)
                .completedAt(now)
                .localDelta(localDelta)
                .contributors(aggregation.contributors())
                .discarded(aggregation.discarded())
                .model(updated)
                .build();
    }

    /**
     * 控制周期开始时调用，取走待采用的新模型
     */
    public ForecastModel takePendingModel() {
        return pendingModel.getAndSet(null);
    }

    public ForecastModel currentModel() {
        return latestModel.get();
    }

    public long getRounds() {
        return rounds.get();
    }
}
