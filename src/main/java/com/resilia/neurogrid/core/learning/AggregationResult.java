package com.resilia.neurogrid.core.learning;

import java.util.List;

/**
 * 一轮聚合的结果
 *
 * @param delta        加权平均后的增量，无有效输入时为 null
 * @param contributors 参与聚合的节点，按ID排序
 * @param discarded    因过期或格式错误被丢弃的节点
 */
public record AggregationResult(double[] delta, List<String> contributors, List<String> discarded) {

    public boolean hasDelta() {
        return delta != null;
    }
}
