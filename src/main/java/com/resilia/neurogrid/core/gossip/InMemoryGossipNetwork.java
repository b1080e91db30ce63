package com.resilia.neurogrid.core.gossip;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * 进程内 gossip 网络，用于本地仿真和测试
 *
 * <p>可为节点设置延迟或断开，模拟慢邻居与网络分区。</p>
 */
@Slf4j
public class InMemoryGossipNetwork {

    private final Map<String, UnaryOperator<PeerSummary>> endpoints = new ConcurrentHashMap<>();
    private final Map<String, Long> latencyMs = new ConcurrentHashMap<>();
    private final Set<String> partitioned = ConcurrentHashMap.newKeySet();
    private final Executor executor;

    public InMemoryGossipNetwork(Executor executor) {
        this.executor = executor;
    }

    public void register(String nodeId, UnaryOperator<PeerSummary> responder) {
        endpoints.put(nodeId, responder);
    }

    public void unregister(String nodeId) {
        endpoints.remove(nodeId);
    }

    public void setLatency(String nodeId, long delayMs) {
        latencyMs.put(nodeId, delayMs);
    }

    public void partition(String nodeId) {
        partitioned.add(nodeId);
    }

    public void heal(String nodeId) {
        partitioned.remove(nodeId);
    }

    CompletableFuture<PeerSummary> deliver(String peerId, PeerSummary request) {
        UnaryOperator<PeerSummary> responder = endpoints.get(peerId);
        if (responder == null || partitioned.contains(peerId) || partitioned.contains(request.getNodeId())) {
            return CompletableFuture.failedFuture(new IllegalStateException("peer not reachable: " + peerId));
        }
        long delay = latencyMs.getOrDefault(peerId, 0L);
        Executor target = delay > 0
                ? CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, executor)
                : executor;
        return CompletableFuture.supplyAsync(() -> responder.apply(request), target);
    }
}
