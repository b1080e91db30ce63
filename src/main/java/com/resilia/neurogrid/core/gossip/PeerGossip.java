package com.resilia.neurogrid.core.gossip;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.common.exception.GridException;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.learning.ModelDelta;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 邻居 gossip
 *
 * <p>每轮从邻居集合中轮转选取 fanout 个节点做 push-pull 交换，单次交换受 timeoutMs 约束，
 * 超时的交换被取消并记为不可达，整轮照常完成。收到的摘要存放在按写入过期的 Caffeine 缓存中。
 * 轮次结果通过原子引用交给控制周期，在下一周期开始时合并。</p>
 */
@Slf4j
@Component
public class PeerGossip {

    private final NeuroGridProperties.GossipConfig config;
    private final String nodeId;
    private final GossipTransport transport;
    private final ScheduledExecutorService scheduler;
    private final PeerSelector selector;
    private final Cache<String, PeerSummary> summaries;

    private final AtomicReference<GossipRoundResult> pendingRound = new AtomicReference<>();
    private final AtomicReference<LocalState> localState =
            new AtomicReference<>(new LocalState(ConnectionState.GRID_CONNECTED, 0.0));
    private final AtomicReference<ModelDelta> outboundDelta = new AtomicReference<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong rounds = new AtomicLong();

    private volatile ScheduledFuture<?> roundTask;

    @Autowired
    public PeerGossip(NeuroGridProperties properties,
                      GossipTransport transport,
                      @Qualifier("backgroundScheduler") ScheduledExecutorService scheduler) {
        this(properties, transport, scheduler, Ticker.systemTicker());
    }

    public PeerGossip(NeuroGridProperties properties,
                      GossipTransport transport,
                      ScheduledExecutorService scheduler,
                      Ticker ticker) {
        this.config = properties.getGossip();
        this.nodeId = properties.getNode().getId();
        this.transport = transport;
        this.scheduler = scheduler;
        List<String> neighbours = new ArrayList<>();
        for (String peer : properties.getNode().getPeers()) {
            if (!nodeId.equals(peer) && !neighbours.contains(peer)) {
                neighbours.add(peer);
            }
        }
        this.selector = new PeerSelector(neighbours);
        this.summaries = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(config.getPeerTtlMs()))
                .maximumSize(Math.max(16, neighbours.size() * 4L))
                .ticker(ticker)
                .build();
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("gossip 未启用");
            return;
        }
        listen();
        roundTask = scheduler.scheduleWithFixedDelay(this::runScheduledRound,
                config.getPeriodMs(), config.getPeriodMs(), TimeUnit.MILLISECONDS);
        log.info("gossip 已启动: transport={}, neighbours={}, fanout={}, period={}ms",
                transport.name(), selector.getNeighbours(), config.getFanout(), config.getPeriodMs());
    }

    /**
     * 注册到传输层，开始响应邻居请求
     */
    public void listen() {
        transport.start(nodeId, this::handleIncoming);
    }

    @PreDestroy
    public void stop() {
        if (roundTask != null) {
            roundTask.cancel(false);
        }
        transport.close();
    }

    private void runScheduledRound() {
        try {
            runRound();
        } catch (Exception e) {
            log.error("gossip 轮次执行失败", e);
        }
    }

    public GossipRoundResult runRound() {
        long round = rounds.incrementAndGet();
        List<String> targets = selector.next(config.getFanout());
        PeerSummary local = localSummary(System.currentTimeMillis());

        Map<String, CompletableFuture<PeerSummary>> inflight = new LinkedHashMap<>();
        for (String peer : targets) {
            try {
                inflight.put(peer, transport.exchange(peer, local));
            } catch (RuntimeException e) {
                inflight.put(peer, CompletableFuture.failedFuture(e));
            }
        }

        GossipRoundResult.GossipRoundResultBuilder builder = GossipRoundResult.builder().round(round);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getTimeoutMs());
        for (Map.Entry<String, CompletableFuture<PeerSummary>> entry : inflight.entrySet()) {
            String peer = entry.getKey();
            CompletableFuture<PeerSummary> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                PeerSummary summary = future.get(remaining, TimeUnit.NANOSECONDS);
                if (summary == null || !peer.equals(summary.getNodeId())) {
                    markUnreachable(builder, peer, new IllegalStateException("unexpected reply from " + peer));
                    continue;
                }
                accept(summary);
                builder.reachable(summary);
            } catch (TimeoutException e) {
                future.cancel(true);
                markUnreachable(builder, peer, e);
            } catch (ExecutionException e) {
                markUnreachable(builder, peer, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                markUnreachable(builder, peer, e);
            } catch (RuntimeException e) {
                markUnreachable(builder, peer, e);
            }
        }

        GossipRoundResult result = builder.completedAt(System.currentTimeMillis()).build();
        pendingRound.set(result);
        log.debug("gossip 第 {} 轮完成: 可达 {}, 不可达 {}", round,
                result.getReachables().size(), result.getUnreachables());
        return result;
    }

    private void markUnreachable(GossipRoundResult.GossipRoundResultBuilder builder, String peer, Throwable cause) {
        GridException error = GridException.peerUnreachable(peer, cause);
        log.warn("{}: {}", error.getMessage(), cause != null ? cause.getClass().getSimpleName() : "-");
        builder.unreachable(peer);
    }

    /**
     * 响应邻居推送的摘要，并返回本地摘要
     */
    public PeerSummary handleIncoming(PeerSummary remote) {
        if (remote != null && remote.getNodeId() != null && !nodeId.equals(remote.getNodeId())) {
            accept(remote);
        }
        return localSummary(System.currentTimeMillis());
    }

    private void accept(PeerSummary summary) {
        summaries.asMap().merge(summary.getNodeId(), summary, (current, incoming) ->
                incoming.getTimestamp() > current.getTimestamp()
                        || (incoming.getTimestamp() == current.getTimestamp()
                        && incoming.getSequence() >= current.getSequence())
                        ? incoming : current);
    }

    public PeerSummary localSummary(long now) {
        LocalState state = localState.get();
        return PeerSummary.builder()
                .nodeId(nodeId)
                .connectionState(state.connectionState())
                .residualKw(state.residualKw())
                .modelDelta(outboundDelta.get())
                .timestamp(now)
                .sequence(sequence.incrementAndGet())
                .build();
    }

    /**
     * 控制周期末发布本地状态
     */
    public void updateLocalState(ConnectionState connectionState, double residualKw) {
        localState.set(new LocalState(connectionState, residualKw));
    }

    public void publishLocalDelta(ModelDelta delta) {
        outboundDelta.set(delta);
    }

    public GossipRoundResult takeRoundResult() {
        return pendingRound.getAndSet(null);
    }

    /**
     * 未过期的邻居摘要，按节点ID排序
     */
    public List<PeerSummary> knownSummaries() {
        summaries.cleanUp();
        List<PeerSummary> result = new ArrayList<>(summaries.asMap().values());
        result.sort(Comparator.comparing(PeerSummary::getNodeId));
        return result;
    }

    public List<ModelDelta> peerModelDeltas() {
        List<ModelDelta> deltas = new ArrayList<>();
        for (PeerSummary summary : knownSummaries()) {
            ModelDelta delta = summary.getModelDelta();
            if (delta != null && !nodeId.equals(delta.getOriginNodeId())) {
                deltas.add(delta);
            }
        }
        return deltas;
    }

    public List<String> getNeighbours() {
        return selector.getNeighbours();
    }

    public String getTransportName() {
        return transport.name();
    }

    private record LocalState(ConnectionState connectionState, double residualKw) {
    }
}
