package com.botframe.core.plan;

import com.botframe.api.config.PluginDescriptor;
import com.botframe.api.plugin.PluginKind;
import com.botframe.core.config.BotFrameConfig;
import com.botframe.core.config.BotFrameConfigLoader;
import com.botframe.core.config.EnablementPolicy;
import com.botframe.core.exception.DependencyException;
import com.botframe.core.loader.PluginDiscoveryService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 启动计划器
 * <p>
 * 职责：
 * 1. 按启用策略判断每个插件是否允许启动
 * 2. 计算每个服务的传递依赖闭包，闭包失败的服务整体剔除
 * 3. 汇总所需工具并给出初始化顺序
 * 4. 缓存计划，直到显式 invalidate
 * <p>
 * 与发现阶段的全图环检测不同，这里遇到问题只缩小计划，不会失败。
 */
@Slf4j
public class StartupPlanner {

    private final PluginDiscoveryService discovery;
    private final BotFrameConfigLoader configLoader;
    private volatile BotFrameConfig config;

    private final ReentrantLock planLock = new ReentrantLock();
    private StartupPlan cachedPlan;

    public StartupPlanner(BotFrameConfig config, PluginDiscoveryService discovery) {
        this(config, discovery, new BotFrameConfigLoader());
    }

    public StartupPlanner(BotFrameConfig config, PluginDiscoveryService discovery, BotFrameConfigLoader configLoader) {
        this.config = config;
        this.discovery = discovery;
        this.configLoader = configLoader;
    }

    // ==================== 启动计划 ====================

    /**
     * 获取启动计划，首次调用时计算并缓存
     */
    public StartupPlan getStartupPlan() {
        planLock.lock();
        try {
            if (cachedPlan == null) {
                cachedPlan = computePlan();
            }
            return cachedPlan;
        } finally {
            planLock.unlock();
        }
    }

    /**
     * 丢弃缓存的计划，下次 getStartupPlan 时重新计算
     */
    public void invalidate() {
        planLock.lock();
        try {
            cachedPlan = null;
        } finally {
            planLock.unlock();
        }
        log.debug("Startup plan invalidated");
    }

    private StartupPlan computePlan() {
        EnablementPolicy policy = config.getEnablementPolicy();
        Set<String> bootstrap = new HashSet<>(config.getBootstrapUtilities());

        List<String> enabledServices = new ArrayList<>();
        Set<String> required = new LinkedHashSet<>();

        for (String service : discovery.getPluginsByKind(PluginKind.SERVICE).keySet()) {
            if (!canStart(service)) {
                log.debug("Service {} cannot start, skipped", service);
                continue;
            }
            Optional<Set<String>> closure = collectTransitiveClosure(service);
            if (closure.isEmpty()) {
                continue;
            }
            enabledServices.add(service);
            closure.get().stream()
                    .filter(name -> !name.equals(service))
                    .forEach(required::add);
        }

        // 按工具级策略再过滤一次
        required.removeIf(name -> {
            if (bootstrap.contains(name) || policy.isEnabled(PluginKind.UTILITY, name)) {
                return false;
            }
            log.info("Utility {} is disabled by policy, removed from required utilities", name);
            return true;
        });

        // 基础工具由宿主创建
        required.removeAll(bootstrap);

        List<String> order = discovery.topologicalOrder(required).order();

        StartupPlan plan = new StartupPlan(enabledServices, required, order);
        log.info("Startup plan computed: {} services, {} utilities, order={}",
                plan.totalServices(), plan.totalUtilities(), plan.dependencyOrder());
        return plan;
    }

    // ==================== 启用判断 ====================

    /**
     * 按策略判断插件是否启用：disabled > enabled > 种类默认值
     */
    public boolean isEnabled(String name) {
        return discovery.getKind(name)
                .map(kind -> config.getEnablementPolicy().isEnabled(kind, name))
                .orElse(false);
    }

    /**
     * 插件是否可以启动：已知、被策略启用、依赖列表上没有局部环
     */
    public boolean canStart(String name) {
        if (discovery.getDescriptor(name).isEmpty()) {
            log.debug("Plugin {} is unknown", name);
            return false;
        }
        if (!isEnabled(name)) {
            log.debug("Plugin {} is disabled by policy", name);
            return false;
        }
        if (hasLocalCycle(name, new LinkedHashSet<>(), new HashSet<>())) {
            log.warn("Plugin {} is part of a dependency cycle, cannot start", name);
            return false;
        }
        return true;
    }

    private boolean hasLocalCycle(String name, Set<String> path, Set<String> done) {
        if (path.contains(name)) {
            return true;
        }
        if (done.contains(name)) {
            return false;
        }
        path.add(name);
        for (String dep : discovery.getDependencies(name)) {
            if (discovery.getDescriptor(dep).isPresent() && hasLocalCycle(dep, path, done)) {
                return true;
            }
        }
        path.remove(name);
        done.add(name);
        return false;
    }

    // ==================== 依赖闭包 ====================

    /**
     * 计算插件的传递依赖闭包（包含自身，依赖在前）
     * <p>
     * 闭包中任何一处出现环、缺失依赖、非工具依赖，或（按配置）被策略禁用的工具，
     * 整个闭包都会被丢弃，返回空。
     */
    public Optional<Set<String>> collectTransitiveClosure(String name) {
        Set<String> closure = new LinkedHashSet<>();
        try {
            walk(name, name, new ArrayDeque<>(), closure);
            return Optional.of(closure);
        } catch (DependencyException e) {
            log.warn("Dependency closure discarded: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void walk(String root, String name, Deque<String> path, Set<String> closure) {
        if (path.contains(name)) {
            throw new DependencyException(root, "circular dependency via " + String.join(" -> ", path) + " -> " + name);
        }
        if (closure.contains(name)) {
            return;
        }
        if (config.getBootstrapUtilities().contains(name)) {
            // 宿主已创建，不再向下展开
            closure.add(name);
            return;
        }

        PluginDescriptor descriptor = discovery.getDescriptor(name).orElseThrow(() ->
                new DependencyException(root, "missing dependency '" + name + "'"
                        + (path.isEmpty() ? "" : " required by " + path.peekLast())));

        if (!name.equals(root)) {
            if (!descriptor.isUtility()) {
                throw new DependencyException(root, "dependency '" + name + "' is a service, not a utility");
            }
            if (config.isDisabledUtilityInvalidatesDependents()
                    && !config.getEnablementPolicy().isEnabled(PluginKind.UTILITY, name)) {
                throw new DependencyException(root, "dependency '" + name + "' is disabled by policy");
            }
        }

        path.addLast(name);
        for (String dep : descriptor.getDependencies()) {
            walk(root, dep, path, closure);
        }
        path.removeLast();
        closure.add(name);
    }

    // ==================== 设置 ====================

    /**
     * 合并插件设置：settings.yaml 中的全局段落优先于插件自身 config.yaml 中的 settings；
     * 本地值若为含 default 键的映射，则取其 default。
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getPluginSettings(String name) {
        Optional<PluginDescriptor> descriptor = discovery.getDescriptor(name);
        if (descriptor.isEmpty()) {
            log.warn("Plugin {} not found", name);
            return Collections.emptyMap();
        }

        Map<String, Object> global = getSettingsSection(name);
        Map<String, Object> local = descriptor.get().getSettings();

        Set<String> keys = new LinkedHashSet<>(local.keySet());
        keys.addAll(global.keySet());

        Map<String, Object> merged = new LinkedHashMap<>();
        for (String key : keys) {
            Object localValue = local.get(key);
            if (localValue instanceof Map<?, ?> map && map.containsKey("default")) {
                localValue = ((Map<String, Object>) map).get("default");
            }
            Object globalValue = global.get(key);
            merged.put(key, globalValue != null ? globalValue : localValue);
        }
        return merged;
    }

    /**
     * settings.yaml 中以插件名为键的全局段落
     */
    public Map<String, Object> getSettingsSection(String section) {
        Map<String, Object> value = config.getPluginSections().get(section);
        return value != null ? Collections.unmodifiableMap(value) : Collections.emptyMap();
    }

    /**
     * 替换配置，不会自动让缓存的计划失效
     */
    public void applyConfig(BotFrameConfig newConfig) {
        this.config = newConfig;
    }

    /**
     * 重新读取设置文件并让计划失效
     */
    public void reload() {
        log.info("Reloading settings...");
        this.config = configLoader.load(config);
        invalidate();
    }

    public BotFrameConfig getConfig() {
        return config;
    }
}
