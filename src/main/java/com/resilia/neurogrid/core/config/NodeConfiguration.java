package com.resilia.neurogrid.core.config;

import com.resilia.neurogrid.common.domain.entity.MicrogridNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 本节点实体，启动时由配置创建
 */
@Slf4j
@Configuration
public class NodeConfiguration {

    @Bean
    public MicrogridNode microgridNode(NeuroGridProperties properties) {
        NeuroGridProperties.NodeConfig node = properties.getNode();
        MicrogridNode microgridNode = new MicrogridNode(node.getId(), node.getName(), node.getZone(),
                node.getLatitude(), node.getLongitude(), node.getPeers());
        log.info("节点 {} ({}) 初始化, 邻居: {}", microgridNode.getNodeId(), microgridNode.getName(),
                microgridNode.getKnownPeerIds());
        return microgridNode;
    }
}
