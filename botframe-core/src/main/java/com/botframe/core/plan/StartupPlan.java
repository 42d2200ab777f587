package com.botframe.core.plan;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 启动计划（不可变）
 *
 * @param enabledServices   可以启动的服务，按发现顺序
 * @param requiredUtilities 这些服务传递依赖的工具（不含宿主预建的基础工具）
 * @param dependencyOrder   工具的初始化顺序，依赖在前；残留环上的工具不在其中
 */
public record StartupPlan(List<String> enabledServices,
                          Set<String> requiredUtilities,
                          List<String> dependencyOrder) {

    public StartupPlan {
        enabledServices = List.copyOf(enabledServices);
        requiredUtilities = Collections.unmodifiableSet(new LinkedHashSet<>(requiredUtilities));
        dependencyOrder = List.copyOf(dependencyOrder);
    }

    public static StartupPlan empty() {
        return new StartupPlan(List.of(), Set.of(), List.of());
    }

    public int totalServices() {
        return enabledServices.size();
    }

    public int totalUtilities() {
        return requiredUtilities.size();
    }

    public boolean isEmpty() {
        return enabledServices.isEmpty();
    }
}
