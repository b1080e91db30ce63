package com.resilia.neurogrid.core.gossip.mqtt;

import com.resilia.neurogrid.core.config.NeuroGridProperties;
import org.eclipse.paho.mqttv5.client.IMqttMessageListener;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.MqttSubscription;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;

import java.nio.charset.StandardCharsets;

/**
 * 基于 Eclipse Paho MQTT v5 的 gossip 客户端
 */
public class PahoV5GossipClient implements MqttGossipClient {

    private static final long OPERATION_TIMEOUT_MS = 5000;

    private final NeuroGridProperties.MqttConfig config;
    private final MqttAsyncClient client;
    private final MqttConnectionOptions options;

    public PahoV5GossipClient(NeuroGridProperties.MqttConfig config, String clientId) throws MqttException {
        this.config = config;
        this.options = new MqttConnectionOptions();
        options.setAutomaticReconnect(true);
        options.setCleanStart(config.isCleanSession());
        options.setConnectionTimeout(config.getConnectionTimeout());
        options.setKeepAliveInterval(config.getKeepAliveInterval());
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            options.setUserName(config.getUsername());
        }
        if (config.getPassword() != null) {
            options.setPassword(config.getPassword().getBytes(StandardCharsets.UTF_8));
        }
        this.client = new MqttAsyncClient(config.getBrokerUrl(), clientId, new MemoryPersistence());
    }

    @Override
    public void connect() throws Exception {
        client.connect(options).waitForCompletion(config.getConnectionTimeout() * 1000L);
        if (!client.isConnected()) {
            throw new IllegalStateException("MQTT v5 gossip client failed to connect");
        }
    }

    @Override
    public void disconnect() throws Exception {
        if (client.isConnected()) {
            client.disconnect().waitForCompletion(OPERATION_TIMEOUT_MS);
        }
        client.close();
    }

    @Override
    public void publish(String topic, MqttMessageEnvelope envelope) throws Exception {
        MqttMessage message = new MqttMessage(envelope.getPayload() != null ? envelope.getPayload() : new byte[0]);
        message.setQos(envelope.getQos());
        MqttProperties properties = new MqttProperties();
        if (envelope.getResponseTopic() != null) {
            properties.setResponseTopic(envelope.getResponseTopic());
        }
        if (envelope.getCorrelationId() != null) {
            properties.setCorrelationData(envelope.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        message.setProperties(properties);
        client.publish(topic, message).waitForCompletion(OPERATION_TIMEOUT_MS);
    }

    @Override
    public void subscribe(String topic, int qos, IncomingMessageHandler handler) throws Exception {
        IMqttMessageListener listener = (receivedTopic, message) -> {
            MqttProperties properties = message.getProperties();
            String responseTopic = properties != null ? properties.getResponseTopic() : null;
            byte[] correlation = properties != null ? properties.getCorrelationData() : null;
            handler.handle(receivedTopic, new MqttMessageEnvelope(message.getPayload(), message.getQos(),
                    responseTopic, correlation != null ? new String(correlation, StandardCharsets.UTF_8) : null));
        };
        client.subscribe(new MqttSubscription(topic, qos), listener).waitForCompletion(OPERATION_TIMEOUT_MS);
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }
}
