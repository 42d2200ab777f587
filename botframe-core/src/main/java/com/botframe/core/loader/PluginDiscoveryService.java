package com.botframe.core.loader;

import com.botframe.api.config.PluginDescriptor;
import com.botframe.api.plugin.PluginKind;
import com.botframe.core.config.BotFrameConfig;
import com.botframe.core.exception.ConfigurationException;
import com.botframe.core.exception.GraphCycleException;
import com.botframe.core.graph.DependencyGraph;
import com.botframe.core.graph.TopologicalOrder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 插件自动发现服务
 * <p>
 * 职责：
 * 1. 递归扫描 utilities 与 services 两个子目录
 * 2. 含有描述文件的目录即为插件，不再向下递归
 * 3. 解析描述文件，跳过 enabled=false 的插件
 * 4. 构建依赖图并做全图环检测（发现环直接失败）
 */
@Slf4j
public class PluginDiscoveryService {

    private final BotFrameConfig config;

    private volatile Path root;

    // 插件描述表：Key=插件名, 保持扫描顺序
    private volatile Map<String, PluginDescriptor> descriptors = Collections.emptyMap();

    private volatile DependencyGraph graph = DependencyGraph.empty();

    public PluginDiscoveryService(BotFrameConfig config) {
        this.config = config;
    }

    /**
     * 扫描配置中的插件根目录
     */
    public Map<String, PluginDescriptor> discover() {
        return discover(config.resolvePluginHome());
    }

    /**
     * 扫描指定插件根目录，构建依赖图并检测环
     *
     * @throws GraphCycleException 存在循环依赖
     */
    public Map<String, PluginDescriptor> discover(Path pluginRoot) {
        this.root = pluginRoot;
        log.info("Loading information about utilities and services from {}", pluginRoot.toAbsolutePath());

        Map<String, PluginDescriptor> found = new LinkedHashMap<>();
        for (PluginKind kind : PluginKind.values()) {
            scanKind(pluginRoot.resolve(kind.getDirectory()), kind, found);
        }

        this.descriptors = Collections.unmodifiableMap(found);
        buildGraph();
        detectCycles();
        return descriptors;
    }

    /**
     * 重新扫描上一次使用的根目录
     */
    public Map<String, PluginDescriptor> reload() {
        Path current = root != null ? root : config.resolvePluginHome();
        log.info("Reloading plugin information...");
        return discover(current);
    }

    /**
     * 基于当前描述表重建依赖图
     */
    public DependencyGraph buildGraph() {
        this.graph = DependencyGraph.build(descriptors);
        log.debug("Dependency graph built: {} nodes, {} edges", graph.nodes().size(), graph.edgeCount());
        return graph;
    }

    /**
     * 全图环检测，比启动计划阶段的降级策略更严格
     *
     * @throws GraphCycleException 存在循环依赖
     */
    public void detectCycles() {
        graph.detectCycles();
    }

    public TopologicalOrder topologicalOrder(Collection<String> subset) {
        return graph.topologicalOrder(subset);
    }

    // ==================== 扫描 ====================

    private void scanKind(Path kindRoot, PluginKind kind, Map<String, PluginDescriptor> target) {
        if (!Files.isDirectory(kindRoot)) {
            log.warn("Directory {} not found: {}", kind.getDirectory(), kindRoot.toAbsolutePath());
            return;
        }
        int before = target.size();
        scanDirectory(kindRoot, kind, target);
        log.info("Loaded {}: {}", kind.getDirectory(), target.size() - before);
    }

    private void scanDirectory(Path directory, PluginKind kind, Map<String, PluginDescriptor> target) {
        for (Path child : listSubdirectories(directory)) {
            Path descriptorFile = child.resolve(config.getDescriptorFileName());
            if (Files.isRegularFile(descriptorFile)) {
                // 找到插件，不再向下递归
                loadSingle(child, descriptorFile, kind, target);
            } else {
                scanDirectory(child, kind, target);
            }
        }
    }

    private void loadSingle(Path pluginDir, Path descriptorFile, PluginKind kind, Map<String, PluginDescriptor> target) {
        try {
            PluginDescriptor descriptor = parse(pluginDir, descriptorFile, kind);
            String name = descriptor.getName();

            if (!descriptor.isEnabled()) {
                log.info("Plugin {} disabled in configuration, skipping", name);
                return;
            }
            if (target.containsKey(name)) {
                log.warn("Duplicate plugin name [{}] at {}, keeping {}",
                        name, pluginDir, target.get(name).getLocation());
                return;
            }
            warnOnMissingSections(descriptor);

            target.put(name, descriptor);
            log.debug("Discovered {} {} at {}", kind.name().toLowerCase(), name, pluginDir);
        } catch (Exception e) {
            // 单个插件的错误不影响同级插件
            log.error("Error loading config for {} at {}: {}", kind.name().toLowerCase(), pluginDir, e.getMessage(), e);
        }
    }

    private PluginDescriptor parse(Path pluginDir, Path descriptorFile, PluginKind kind) {
        try (InputStream in = Files.newInputStream(descriptorFile)) {
            return PluginManifestLoader.load(in, kind, pluginDir);
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationException("Invalid plugin descriptor: " + descriptorFile, e);
        }
    }

    private void warnOnMissingSections(PluginDescriptor descriptor) {
        if (descriptor.isUtility() && descriptor.getMethods().isEmpty()) {
            log.warn("Utility {} does not have methods section", descriptor.getName());
        } else if (descriptor.isService() && descriptor.getActions().isEmpty()) {
            log.warn("Service {} does not have actions section", descriptor.getName());
        }
    }

    private static List<Path> listSubdirectories(Path directory) {
        try (Stream<Path> children = Files.list(directory)) {
            return children.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list directory: {}", directory, e);
            return Collections.emptyList();
        }
    }

    // ==================== 查询 ====================

    public Optional<PluginDescriptor> getDescriptor(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public Optional<PluginKind> getKind(String name) {
        return getDescriptor(name).map(PluginDescriptor::getKind);
    }

    /**
     * 声明的全部依赖名（原样，含无效目标）
     */
    public Set<String> getDependencies(String name) {
        return getDescriptor(name).map(PluginDescriptor::getDependencies).orElse(Collections.emptySet());
    }

    public Map<String, PluginDescriptor> getPluginsByKind(PluginKind kind) {
        Map<String, PluginDescriptor> result = new LinkedHashMap<>();
        descriptors.forEach((name, descriptor) -> {
            if (descriptor.getKind() == kind) {
                result.put(name, descriptor);
            }
        });
        return result;
    }

    public Map<String, PluginDescriptor> getAllPlugins() {
        return descriptors;
    }

    public DependencyGraph getGraph() {
        return graph;
    }
}
