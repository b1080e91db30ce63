package com.resilia.neurogrid.core.gossip.mqtt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.gossip.GossipTransport;
import com.resilia.neurogrid.core.gossip.PeerSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * MQTT v5 请求/响应式 gossip 传输
 *
 * <p>请求发往 {prefix}/{peer}/req，携带响应主题 {prefix}/{self}/resp 与关联ID；
 * 对端处理后回发到响应主题，本端按关联ID完成对应的 future。</p>
 */
@Slf4j
public class MqttGossipTransport implements GossipTransport {

    private final NeuroGridProperties.MqttConfig config;
    private final MqttGossipClient client;
    private final ObjectMapper objectMapper;
    private final Map<String, CompletableFuture<PeerSummary>> pending = new ConcurrentHashMap<>();

    private volatile String localNodeId;
    private volatile UnaryOperator<PeerSummary> responder;

    public MqttGossipTransport(NeuroGridProperties.MqttConfig config, MqttGossipClient client, ObjectMapper objectMapper) {
        this.config = config;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public void start(String localNodeId, UnaryOperator<PeerSummary> responder) {
        this.localNodeId = localNodeId;
        this.responder = responder;
        try {
            client.connect();
            client.subscribe(requestTopic(localNodeId), config.getQos(), this::onRequest);
            client.subscribe(responseTopic(localNodeId), config.getQos(), this::onResponse);
            log.info("MQTT gossip 传输已启动: broker={}, node={}", config.getBrokerUrl(), localNodeId);
        } catch (Exception e) {
            throw new IllegalStateException("MQTT gossip transport failed to start: " + e.getMessage(), e);
        }
    }

    @Override
    public CompletableFuture<PeerSummary> exchange(String peerId, PeerSummary local) {
        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<PeerSummary> future = new CompletableFuture<>();
        pending.put(correlationId, future);
        future.whenComplete((result, error) -> pending.remove(correlationId));
        try {
            byte[] payload = objectMapper.writeValueAsBytes(local);
            client.publish(requestTopic(peerId),
                    new MqttMessageEnvelope(payload, config.getQos(), responseTopic(localNodeId), correlationId));
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public String name() {
        return "mqtt";
    }

    @Override
    public void close() {
        pending.values().forEach(future -> future.cancel(true));
        pending.clear();
        try {
            client.close();
        } catch (Exception e) {
            log.warn("关闭 MQTT gossip 客户端失败: {}", e.getMessage());
        }
    }

    int pendingExchanges() {
        return pending.size();
    }

    private void onRequest(String topic, MqttMessageEnvelope envelope) {
        if (envelope.getResponseTopic() == null) {
            log.debug("忽略缺少响应主题的 gossip 请求: {}", topic);
            return;
        }
        try {
            PeerSummary remote = objectMapper.readValue(envelope.getPayload(), PeerSummary.class);
            PeerSummary reply = responder.apply(remote);
            client.publish(envelope.getResponseTopic(), new MqttMessageEnvelope(
                    objectMapper.writeValueAsBytes(reply), config.getQos(), null, envelope.getCorrelationId()));
        } catch (JsonProcessingException e) {
            log.warn("无法解析 gossip 请求 {}: {}", topic, e.getOriginalMessage());
        } catch (Exception e) {
            log.warn("处理 gossip 请求失败 {}: {}", topic, e.getMessage());
        }
    }

    private void onResponse(String topic, MqttMessageEnvelope envelope) {
        CompletableFuture<PeerSummary> future = envelope.getCorrelationId() != null
                ? pending.get(envelope.getCorrelationId())
                : null;
        if (future == null) {
            log.debug("收到迟到或未知的 gossip 响应: {}", envelope.getCorrelationId());
            return;
        }
        try {
            future.complete(objectMapper.readValue(envelope.getPayload(), PeerSummary.class));
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
    }

    String requestTopic(String nodeId) {
        return config.getTopicPrefix() + "/" + nodeId + "/req";
    }

    String responseTopic(String nodeId) {
        return config.getTopicPrefix() + "/" + nodeId + "/resp";
    }
}
