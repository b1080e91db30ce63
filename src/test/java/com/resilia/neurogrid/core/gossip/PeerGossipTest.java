package com.resilia.neurogrid.core.gossip;

import com.github.benmanes.caffeine.cache.Ticker;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PeerGossipTest {

    private ExecutorService networkExecutor;
    private ScheduledExecutorService scheduler;
    private InMemoryGossipNetwork network;

    @BeforeEach
    void setUp() {
        networkExecutor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        network = new InMemoryGossipNetwork(networkExecutor);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        networkExecutor.shutdownNow();
    }

    @Test
    void roundExchangesSummariesWithReachablePeers() {
        PeerGossip a = node("node-a", List.of("node-b", "node-c"));
        PeerGossip b = node("node-b", List.of("node-a"));
        PeerGossip c = node("node-c", List.of("node-a"));
        b.updateLocalState(ConnectionState.ISLAND_STABLE, 12.5);
        c.updateLocalState(ConnectionState.GRID_CONNECTED, -4.0);
        a.updateLocalState(ConnectionState.GRID_CONNECTED, 3.0);

        GossipRoundResult result = a.runRound();

        assertEquals(2, result.getReachables().size());
        assertTrue(result.getUnreachables().isEmpty());
        List<PeerSummary> known = a.knownSummaries();
        assertEquals(List.of("node-b", "node-c"), List.of(known.get(0).getNodeId(), known.get(1).getNodeId()));
        assertEquals(12.5, known.get(0).getResidualKw());
        assertEquals(ConnectionState.ISLAND_STABLE, known.get(0).getConnectionState());

        // push-pull：对端也收到了本地摘要
        assertEquals(3.0, b.knownSummaries().get(0).getResidualKw());
        assertEquals("node-a", c.knownSummaries().get(0).getNodeId());
    }

    @Test
    void slowPeerIsMarkedUnreachableWithoutBlockingRound() {
        NeuroGridProperties properties = properties("node-a", List.of("node-b", "node-slow"));
        properties.getGossip().setTimeoutMs(200);
        PeerGossip a = new PeerGossip(properties, new InMemoryGossipTransport(network), scheduler);
        a.listen();
        node("node-b", List.of("node-a"));
        network.register("node-slow", request -> PeerSummary.builder().nodeId("node-slow").timestamp(1).build());
        network.setLatency("node-slow", 2_000);

        long started = System.nanoTime();
        GossipRoundResult result = a.runRound();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(List.of("node-slow"), result.getUnreachables());
        assertEquals(1, result.getReachables().size());
        assertTrue(elapsedMs < 1_500, "round took " + elapsedMs + "ms");
    }

    @Test
    void partitionedAndUnknownPeersAreUnreachable() {
        PeerGossip a = node("node-a", List.of("node-b", "node-ghost"));
        node("node-b", List.of("node-a"));
        network.partition("node-b");

        GossipRoundResult result = a.runRound();

        assertEquals(List.of("node-b", "node-ghost"), result.getUnreachables());
        assertTrue(a.knownSummaries().isEmpty());

        network.heal("node-b");
        assertEquals(1, a.runRound().getReachables().size());
    }

    @Test
    void roundResultIsHandedOverOnce() {
        PeerGossip a = node("node-a", List.of("node-b"));
        node("node-b", List.of("node-a"));

        a.runRound();

        assertNotNull(a.takeRoundResult());
        assertNull(a.takeRoundResult());
    }

    @Test
    void summariesExpireAfterTtl() {
        AtomicLong nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        NeuroGridProperties properties = properties("node-a", List.of("node-b"));
        properties.getGossip().setPeerTtlMs(15_000);
        PeerGossip a = new PeerGossip(properties, new InMemoryGossipTransport(network), scheduler, ticker);

        a.handleIncoming(PeerSummary.builder().nodeId("node-b").residualKw(5).timestamp(1_000).sequence(1).build());
        assertEquals(1, a.knownSummaries().size());

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(15_001));
        assertTrue(a.knownSummaries().isEmpty());
    }

    @Test
    void olderSummaryDoesNotReplaceNewer() {
        PeerGossip a = new PeerGossip(properties("node-a", List.of("node-b")),
                new InMemoryGossipTransport(network), scheduler);

        a.handleIncoming(PeerSummary.builder().nodeId("node-b").residualKw(5).timestamp(2_000).sequence(2).build());
        a.handleIncoming(PeerSummary.builder().nodeId("node-b").residualKw(-9).timestamp(1_000).sequence(1).build());
        a.handleIncoming(PeerSummary.builder().nodeId("node-a").residualKw(99).timestamp(3_000).sequence(3).build());

        List<PeerSummary> known = a.knownSummaries();
        assertEquals(1, known.size());
        assertEquals(5.0, known.get(0).getResidualKw());
    }

    @Test
    void selectorCyclesThroughNeighbours() {
        PeerSelector selector = new PeerSelector(List.of("a", "b", "c", "d", "e"));

        assertEquals(List.of("a", "b"), selector.next(2));
        assertEquals(List.of("c", "d"), selector.next(2));
        assertEquals(List.of("e", "a"), selector.next(2));
        assertEquals(5, selector.next(9).size());
        assertTrue(new PeerSelector(List.of()).next(3).isEmpty());
    }

    @Test
    void selfIsExcludedFromNeighbours() {
        PeerGossip a = new PeerGossip(properties("node-a", List.of("node-a", "node-b", "node-b")),
                new InMemoryGossipTransport(network), scheduler);

        assertEquals(List.of("node-b"), a.getNeighbours());
        assertEquals("in-memory", a.getTransportName());
    }

    private PeerGossip node(String nodeId, List<String> peers) {
        PeerGossip gossip = new PeerGossip(properties(nodeId, peers), new InMemoryGossipTransport(network), scheduler);
        gossip.listen();
        return gossip;
    }

    private static NeuroGridProperties properties(String nodeId, List<String> peers) {
        NeuroGridProperties properties = new NeuroGridProperties();
        properties.getNode().setId(nodeId);
        properties.getNode().setPeers(peers);
        properties.getGossip().setFanout(3);
        properties.getGossip().setTimeoutMs(1_000);
        return properties;
    }
}
