package com.botframe.core.graph;

import java.util.List;
import java.util.Set;

/**
 * 拓扑排序结果
 *
 * @param order  依赖在前的初始化顺序，不含环上的节点
 * @param cyclic 残留环上的节点
 */
public record TopologicalOrder(List<String> order, Set<String> cyclic) {

    public TopologicalOrder {
        order = List.copyOf(order);
        cyclic = Set.copyOf(cyclic);
    }

    public boolean hasCycle() {
        return !cyclic.isEmpty();
    }
}
