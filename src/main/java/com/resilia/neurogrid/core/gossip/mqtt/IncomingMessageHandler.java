package com.resilia.neurogrid.core.gossip.mqtt;

@FunctionalInterface
public interface IncomingMessageHandler {
    void handle(String topic, MqttMessageEnvelope envelope);
}
