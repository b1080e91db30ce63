package com.resilia.neurogrid.core.gossip;

import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * 基于 {@link InMemoryGossipNetwork} 的传输实现
 */
public class InMemoryGossipTransport implements GossipTransport {

    private final InMemoryGossipNetwork network;
    private volatile String localNodeId;

    public InMemoryGossipTransport(InMemoryGossipNetwork network) {
        this.network = network;
    }

    @Override
    public void start(String localNodeId, UnaryOperator<PeerSummary> responder) {
        this.localNodeId = localNodeId;
        network.register(localNodeId, responder);
    }

    @Override
    public CompletableFuture<PeerSummary> exchange(String peerId, PeerSummary local) {
        return network.deliver(peerId, local);
    }

    @Override
    public String name() {
        return "in-memory";
    }

    @Override
    public void close() {
        if (localNodeId != null) {
            network.unregister(localNodeId);
        }
    }
}
