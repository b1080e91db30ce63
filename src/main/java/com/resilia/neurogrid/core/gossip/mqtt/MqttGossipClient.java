package com.resilia.neurogrid.core.gossip.mqtt;

public interface MqttGossipClient extends AutoCloseable {

    void connect() throws Exception;

    void disconnect() throws Exception;

    void publish(String topic, MqttMessageEnvelope envelope) throws Exception;

    void subscribe(String topic, int qos, IncomingMessageHandler handler) throws Exception;

    boolean isConnected();

    @Override
    default void close() throws Exception {
        disconnect();
    }
}
