package com.resilia.neurogrid.common.domain.entity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MicrogridNodeTest {

    private MicrogridNode node;

    @BeforeEach
    void setUp() {
        node = new MicrogridNode("node-a", null, "zone-1", 0, 0, Arrays.asList("node-b", "node-a", " ", null, "node-c"));
    }

    @Test
    void selfAndBlankPeerIdsAreIgnored() {
        assertEquals(List.of("node-b", "node-c"), node.getKnownPeerIds());
        assertEquals("node-a", node.getName());
    }

    @Test
    void peerSnapshotIsDetachedFromNodeState() {
        node.recordPeerContact("node-b", true, 1_000);

        List<MicrogridNode.PeerStatus> snapshot = node.peerStatusSnapshot();
        snapshot.get(0).setReachable(false);
        snapshot.get(0).setConsecutiveMisses(7);
        snapshot.clear();

        MicrogridNode.PeerStatus peerB = node.peerStatusSnapshot().get(0);
        assertEquals("node-b", peerB.getPeerId());
        assertTrue(peerB.isReachable());
        assertEquals(1_000, peerB.getLastSeenAt());
        assertEquals(0, peerB.getConsecutiveMisses());
    }

    @Test
    void missesAccumulateUntilNextContact() {
        node.recordPeerContact("node-c", false, 1_000);
        node.recordPeerContact("node-c", false, 2_000);
        assertEquals(2, node.peerStatusSnapshot().get(1).getConsecutiveMisses());

        node.recordPeerContact("node-c", true, 3_000);
        MicrogridNode.PeerStatus peerC = node.peerStatusSnapshot().get(1);
        assertEquals(0, peerC.getConsecutiveMisses());
        assertEquals(3_000, peerC.getLastSeenAt());

        // 未配置的邻居不会被加入
        node.recordPeerContact("node-z", true, 3_000);
        assertEquals(2, node.peerStatusSnapshot().size());
    }
}
