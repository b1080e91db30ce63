package com.resilia.neurogrid.core.dispatch;

import com.resilia.neurogrid.common.domain.enums.StorageType;
import lombok.Builder;
import lombok.Value;

/**
 * 单个储能层级的计划功率，充电为正、放电为负
 */
@Value
@Builder
public class TierFlow {

    String tierId;

    StorageType type;

    int responseRank;

    double flowKw;

    public boolean isCharging() {
        return flowKw > 0;
    }

    public boolean isDischarging() {
        return flowKw < 0;
    }
}
