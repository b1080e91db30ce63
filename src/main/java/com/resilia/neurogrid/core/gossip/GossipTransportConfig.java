package com.resilia.neurogrid.core.gossip;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resilia.neurogrid.core.config.NeuroGridProperties;
import com.resilia.neurogrid.core.gossip.mqtt.MqttGossipTransport;
import com.resilia.neurogrid.core.gossip.mqtt.PahoV5GossipClient;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 按配置选择 gossip 传输层
 */
@Slf4j
@Configuration
public class GossipTransportConfig {

    // 传输层由 PeerGossip 负责关闭
    @Bean(destroyMethod = "")
    public GossipTransport gossipTransport(NeuroGridProperties properties,
                                           ObjectMapper objectMapper,
                                           @Qualifier("gossipExchangeExecutor") ThreadPoolExecutor executor) {
        NeuroGridProperties.GossipConfig gossip = properties.getGossip();
        if ("MQTT".equalsIgnoreCase(gossip.getTransport())) {
            NeuroGridProperties.MqttConfig mqtt = gossip.getMqtt();
            String clientId = mqtt.getClientId() != null && !mqtt.getClientId().isBlank()
                    ? mqtt.getClientId()
                    : "neurogrid-" + properties.getNode().getId();
            try {
                return new MqttGossipTransport(mqtt, new PahoV5GossipClient(mqtt, clientId), objectMapper);
            } catch (MqttException e) {
                throw new IllegalStateException("无法创建 MQTT gossip 客户端: " + e.getMessage(), e);
            }
        }
        log.info("使用进程内 gossip 传输");
        return new InMemoryGossipTransport(new InMemoryGossipNetwork(executor));
    }
}
