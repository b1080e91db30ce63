package com.resilia.neurogrid.core.gossip.mqtt;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * MQTT v5 请求/响应消息，响应主题与关联数据来自 v5 属性
 */
@Getter
@RequiredArgsConstructor
public class MqttMessageEnvelope {
    private final byte[] payload;
    private final int qos;
    private final String responseTopic;
    private final String correlationId;
}
