package com.resilia.neurogrid.core.gossip;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一轮 gossip 的结果，由控制周期在下一周期开始时合并
 */
@Value
@Builder
public class GossipRoundResult {

    long round;

    long completedAt;

    @Singular
    List<PeerSummary> reachables;

    @Singular
    List<String> unreachables;
}
