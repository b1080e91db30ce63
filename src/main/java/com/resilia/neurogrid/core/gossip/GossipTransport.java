package com.resilia.neurogrid.core.gossip;

import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * gossip 传输层
 */
public interface GossipTransport extends AutoCloseable {

    /**
     * 开始接收邻居请求，responder 收到对方摘要后返回本地摘要
     */
    void start(String localNodeId, UnaryOperator<PeerSummary> responder);

    /**
     * push-pull 交换：发送本地摘要并等待对方摘要
     */
    CompletableFuture<PeerSummary> exchange(String peerId, PeerSummary local);

    String name();

    @Override
    void close();
}
