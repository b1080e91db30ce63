package com.resilia.neurogrid.api.controller;

import com.resilia.neurogrid.common.domain.entity.MicrogridNode;
import com.resilia.neurogrid.common.web.result.ApiResult;
import com.resilia.neurogrid.core.controller.LocalController;
import com.resilia.neurogrid.core.gossip.PeerGossip;
import com.resilia.neurogrid.core.learning.FederatedLearningCoordinator;
import com.resilia.neurogrid.core.learning.ForecastModel;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 邻居与模型查询接口
 */
@RestController
@RequiredArgsConstructor
public class GossipController {

    private final PeerGossip peerGossip;
    private final LocalController localController;
    private final FederatedLearningCoordinator learningCoordinator;

    @GetMapping("/api/gossip/peers")
    public ApiResult<Map<String, Object>> peers() {
        List<MicrogridNode.PeerStatus> statuses = localController.latestSnapshot().getPeers();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("transport", peerGossip.getTransportName());
        data.put("neighbours", peerGossip.getNeighbours());
        data.put("status", statuses);
        data.put("summaries", peerGossip.knownSummaries());
        return ApiResult.success(data);
    }

    @GetMapping("/api/learning/model")
    public ApiResult<Map<String, Object>> model() {
        ForecastModel latest = learningCoordinator.currentModel();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("latest", latest);
        data.put("activeVersion", localController.activeModel().getVersion());
        data.put("rounds", learningCoordinator.getRounds());
        return ApiResult.success(data);
    }
}
