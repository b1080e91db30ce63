package com.resilia.neurogrid.common.domain.entity;

import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 微电网节点
 *
 * <p>启动时由配置创建，运行期间不销毁。连接状态只由孤岛状态机写入；
 * 邻居可达性由控制周期在合并 gossip 结果时写入。</p>
 */
@Getter
public class MicrogridNode {

    private final String nodeId;
    private final String name;
    private final String zone;
    private final double latitude;
    private final double longitude;

    /**
     * 只通过 recordPeerContact 修改，对外只给 peerStatusSnapshot 副本
     */
    @Getter(AccessLevel.NONE)
    private final Map<String, PeerStatus> peers = new LinkedHashMap<>();

    private volatile ConnectionState connectionState = ConnectionState.GRID_CONNECTED;

    public MicrogridNode(String nodeId, String name, String zone,
                         double latitude, double longitude, Collection<String> peerIds) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        this.nodeId = nodeId;
        this.name = name != null ? name : nodeId;
        this.zone = zone;
        this.latitude = latitude;
        this.longitude = longitude;
        if (peerIds != null) {
            for (String peerId : peerIds) {
                if (peerId != null && !peerId.isBlank() && !peerId.equals(nodeId)) {
                    peers.put(peerId, new PeerStatus(peerId));
                }
            }
        }
    }

    public List<String> getKnownPeerIds() {
        return Collections.unmodifiableList(new ArrayList<>(peers.keySet()));
    }

    public void setConnectionState(ConnectionState connectionState) {
        this.connectionState = connectionState;
    }

    /**
     * 记录一次与邻居的交换结果
     */
    public void recordPeerContact(String peerId, boolean reachable, long timestamp) {
        PeerStatus status = peers.get(peerId);
        if (status == null) {
            return;
        }
        status.setReachable(reachable);
        if (reachable) {
            status.setLastSeenAt(timestamp);
            status.setConsecutiveMisses(0);
        } else {
            status.setConsecutiveMisses(status.getConsecutiveMisses() + 1);
        }
    }

    public List<PeerStatus> peerStatusSnapshot() {
        List<PeerStatus> result = new ArrayList<>(peers.size());
        for (PeerStatus status : peers.values()) {
            PeerStatus copy = new PeerStatus(status.getPeerId());
            copy.setReachable(status.isReachable());
            copy.setLastSeenAt(status.getLastSeenAt());
            copy.setConsecutiveMisses(status.getConsecutiveMisses());
            result.add(copy);
        }
        return result;
    }

    @Data
    public static class PeerStatus {
        private final String peerId;
        private boolean reachable;
        private long lastSeenAt;
        private int consecutiveMisses;
    }
}
