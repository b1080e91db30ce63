package com.resilia.neurogrid.core.gossip;

import com.resilia.neurogrid.common.domain.enums.ConnectionState;
import com.resilia.neurogrid.core.learning.ModelDelta;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 邻居间交换的摘要，不包含任何遥测
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PeerSummary {

    String nodeId;

    ConnectionState connectionState;

    /**
     * 本周期残差：正值为可外送的盈余，负值为缺额
     */
    double residualKw;

    /**
     * 可选的本地模型增量
     */
    ModelDelta modelDelta;

    long timestamp;

    /**
     * 发送方单调递增序号
     */
    long sequence;

    public boolean hasSurplus(double toleranceKw) {
        return residualKw > toleranceKw;
    }

    public boolean hasDeficit(double toleranceKw) {
        return residualKw < -toleranceKw;
    }
}
