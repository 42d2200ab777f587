package com.botframe.core.graph;

import com.botframe.api.config.PluginDescriptor;
import com.botframe.core.exception.GraphCycleException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 插件依赖图
 * <p>
 * 只保留指向已知工具的边；指向服务或未知名称的边在构建时被丢弃并记录警告，
 * 原始依赖名仍保留在描述对象上供启动计划使用。
 */
@Slf4j
public final class DependencyGraph {

    private enum Mark {VISITING, DONE}

    // Key=插件名, Value=它依赖的工具名
    private final Map<String, Set<String>> adjacency;

    private DependencyGraph(Map<String, Set<String>> adjacency) {
        this.adjacency = adjacency;
    }

    public static DependencyGraph build(Map<String, PluginDescriptor> plugins) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (PluginDescriptor descriptor : plugins.values()) {
            Set<String> edges = new LinkedHashSet<>();
            for (String dep : descriptor.getDependencies()) {
                PluginDescriptor target = plugins.get(dep);
                if (target == null) {
                    log.warn("[{}] Depends on non-existent utility: {}", descriptor.getName(), dep);
                } else if (!target.isUtility()) {
                    log.warn("[{}] Depends on service '{}', only utilities can be dependencies", descriptor.getName(), dep);
                } else {
                    edges.add(dep);
                }
            }
            adjacency.put(descriptor.getName(), edges);
        }
        return new DependencyGraph(adjacency);
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(new LinkedHashMap<>());
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public Set<String> dependenciesOf(String name) {
        Set<String> edges = adjacency.get(name);
        return edges == null ? Collections.emptySet() : Collections.unmodifiableSet(edges);
    }

    public int edgeCount() {
        return adjacency.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * 全图环检测
     *
     * @throws GraphCycleException 发现任意回边
     */
    public void detectCycles() {
        Map<String, Mark> marks = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        for (String node : adjacency.keySet()) {
            if (!marks.containsKey(node)) {
                List<String> cycle = findCycle(node, marks, path);
                if (cycle != null) {
                    throw new GraphCycleException(cycle);
                }
            }
        }
    }

    private List<String> findCycle(String node, Map<String, Mark> marks, Deque<String> path) {
        marks.put(node, Mark.VISITING);
        path.addLast(node);
        for (String dep : dependenciesOf(node)) {
            Mark mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                return cyclePath(path, dep);
            }
            if (mark == null) {
                List<String> cycle = findCycle(dep, marks, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.removeLast();
        marks.put(node, Mark.DONE);
        return null;
    }

    /**
     * 在给定子集上做拓扑排序，只考虑子集内部的边
     * <p>
     * 返回的顺序中依赖总在依赖方之前；残留环上的节点不进入顺序，只在结果中标记。
     */
    public TopologicalOrder topologicalOrder(Collection<String> subset) {
        Set<String> members = new LinkedHashSet<>(subset);
        Map<String, Mark> marks = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        List<String> order = new ArrayList<>();
        Set<String> cyclic = new LinkedHashSet<>();

        for (String node : members) {
            if (!marks.containsKey(node)) {
                visit(node, members, marks, path, order, cyclic);
            }
        }

        if (!cyclic.isEmpty()) {
            log.warn("Residual cycle among {}, dropped from initialization order", cyclic);
            order.removeIf(cyclic::contains);
        }
        return new TopologicalOrder(order, cyclic);
    }

    private void visit(String node, Set<String> members, Map<String, Mark> marks,
                       Deque<String> path, List<String> order, Set<String> cyclic) {
        marks.put(node, Mark.VISITING);
        path.addLast(node);
        for (String dep : dependenciesOf(node)) {
            if (!members.contains(dep)) {
                continue;
            }
            Mark mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                List<String> cycle = cyclePath(path, dep);
                cyclic.addAll(cycle);
            } else if (mark == null) {
                visit(dep, members, marks, path, order, cyclic);
            }
        }
        path.removeLast();
        marks.put(node, Mark.DONE);
        order.add(node);
    }

    /**
     * 从 path 中截取以 start 开头的环，并在末尾补上 start
     */
    private static List<String> cyclePath(Deque<String> path, String start) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        Iterator<String> it = path.iterator();
        while (it.hasNext()) {
            String current = it.next();
            if (current.equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(current);
            }
        }
        cycle.add(start);
        return cycle;
    }
}
