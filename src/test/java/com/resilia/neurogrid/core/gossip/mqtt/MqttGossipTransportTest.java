package com.resilia.neurogrid.core.gossip.mqtt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.gossip.PeerSummary;
import com.resilia.neurogrid.core.learning.ModelDelta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class MqttGossipTransportTest {

    private NeuroGridProperties.MqttConfig config;
    private LoopbackBroker broker;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        config = new NeuroGridProperties.MqttConfig();
        config.setTopicPrefix("test/gossip");
        broker = new LoopbackBroker();
        objectMapper = new ObjectMapper();
    }

    @Test
    void exchangeRoundTripsThroughResponseTopic() throws Exception {
        List<PeerSummary> receivedByB = new ArrayList<>();
        MqttGossipTransport a = new MqttGossipTransport(config, broker.client(), objectMapper);
        MqttGossipTransport b = new MqttGossipTransport(config, broker.client(), objectMapper);
        a.start("node-a", remote -> summary("node-a", 0));
        b.start("node-b", remote -> {
            receivedByB.add(remote);
            return summary("node-b", -7.5);
        });

        PeerSummary local = summary("node-a", 4.0).toBuilder()
                .modelDelta(ModelDelta.builder()
                        .originNodeId("node-a")
                        .createdAt(1_000)
                        .sampleCount(3)
                        .deltas(new double[]{0.01, 0, 0, 0, 0})
                        .build())
                .build();
        PeerSummary reply = a.exchange("node-b", local).get(1, TimeUnit.SECONDS);

        assertEquals("node-b", reply.getNodeId());
        assertEquals(-7.5, reply.getResidualKw());
        assertEquals(1, receivedByB.size());
        assertEquals(4.0, receivedByB.get(0).getResidualKw());
        assertArrayEquals(new double[]{0.01, 0, 0, 0, 0}, receivedByB.get(0).getModelDelta().getDeltas());
        assertEquals(0, a.pendingExchanges());
        assertTrue(broker.published.contains("test/gossip/node-b/req"));
        assertTrue(broker.published.contains("test/gossip/node-a/resp"));
    }

    @Test
    void unansweredExchangeStaysPendingUntilClosed() {
        MqttGossipTransport a = new MqttGossipTransport(config, broker.client(), objectMapper);
        a.start("node-a", remote -> summary("node-a", 0));

        CompletableFuture<PeerSummary> future = a.exchange("node-offline", summary("node-a", 1));

        assertThrows(TimeoutException.class, () -> future.get(50, TimeUnit.MILLISECONDS));
        assertEquals(1, a.pendingExchanges());

        a.close();
        assertTrue(future.isCancelled());
        assertEquals(0, a.pendingExchanges());
    }

    @Test
    void publishFailureCompletesExceptionally() {
        broker.failPublish = true;
        MqttGossipTransport a = new MqttGossipTransport(config, broker.client(), objectMapper);
        a.start("node-a", remote -> summary("node-a", 0));

        CompletableFuture<PeerSummary> future = a.exchange("node-b", summary("node-a", 1));

        assertTrue(future.isCompletedExceptionally());
        assertEquals("mqtt", a.name());
        assertEquals("test/gossip/node-a/req", a.requestTopic("node-a"));
        assertEquals("test/gossip/node-a/resp", a.responseTopic("node-a"));
    }

    private static PeerSummary summary(String nodeId, double residualKw) {
        return PeerSummary.builder()
                .nodeId(nodeId)
                .connectionState(ConnectionState.GRID_CONNECTED)
                .residualKw(residualKw)
                .timestamp(1_000)
                .sequence(1)
                .build();
    }

    /**
     * 同步投递的进程内 broker
     */
    private static class LoopbackBroker {

        private final Map<String, IncomingMessageHandler> subscriptions = new ConcurrentHashMap<>();
        private final List<String> published = new ArrayList<>();
        private volatile boolean failPublish;

        MqttGossipClient client() {
            return new MqttGossipClient() {
                private boolean connected;

                @Override
                public void connect() {
                    connected = true;
                }

                @Override
                public void disconnect() {
                    connected = false;
                }

                @Override
                public void publish(String topic, MqttMessageEnvelope envelope) throws Exception {
                    if (failPublish) {
                        throw new IllegalStateException("broker unavailable");
                    }
                    published.add(topic);
                    IncomingMessageHandler handler = subscriptions.get(topic);
                    if (handler != null) {
                        handler.handle(topic, envelope);
                    }
                }

                @Override
                public void subscribe(String topic, int qos, IncomingMessageHandler handler) {
                    subscriptions.put(topic, handler);
                }

                @Override
                public boolean isConnected() {
                    return connected;
                }
            };
        }
    }
}
