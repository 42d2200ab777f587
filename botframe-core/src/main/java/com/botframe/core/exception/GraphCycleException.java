package com.botframe.core.exception;

import com.botframe.api.exception.BotFrameException;

import java.util.List;

/**
 * 发现阶段检测到循环依赖
 * 进程在启动任何插件之前就会因此中止
 */
public class GraphCycleException extends BotFrameException {

    private final List<String> cycle;

    public GraphCycleException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * 环上的插件，首尾相同
     */
    public List<String> getCycle() {
        return cycle;
    }
}
