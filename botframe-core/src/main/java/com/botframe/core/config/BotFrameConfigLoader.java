package com.botframe.core.config;

import com.botframe.core.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 从 settings.yaml 构建 {@link BotFrameConfig}
 * <p>
 * 文件结构：
 * <pre>
 * plugins:
 *   services:  { enabled: [...], disabled: [...], default_enabled: false }
 *   utilities: { enabled: [...], disabled: [...], default_enabled: true }
 * shutdown:
 *   plugin_shutdown_timeout: 3.0
 *   background_tasks_timeout: 2.0
 * planner:
 *   disabled_utility_invalidates_dependents: true
 * some_plugin:            # 其余顶层段落为插件全局设置
 *   key: value
 * </pre>
 */
@Slf4j
public class BotFrameConfigLoader {

    public static final String PROJECT_ROOT_ENV = "PROJECT_ROOT";

    private static final String PLUGINS = "plugins";
    private static final String SHUTDOWN = "shutdown";
    private static final String PLANNER = "planner";
    private static final Set<String> RESERVED_SECTIONS = Set.of(PLUGINS, SHUTDOWN, PLANNER);

    /**
     * 项目根目录：优先使用 PROJECT_ROOT 环境变量（目录存在时），否则使用当前工作目录
     */
    public static String resolveProjectRoot() {
        String env = System.getenv(PROJECT_ROOT_ENV);
        if (env != null && !env.isBlank() && Files.isDirectory(Paths.get(env))) {
            return env;
        }
        return ".";
    }

    /**
     * 使用默认目录布局加载
     */
    public BotFrameConfig load(String projectRoot) {
        return load(BotFrameConfig.builder().projectRoot(projectRoot).build());
    }

    /**
     * 保留模板中的目录布局，重新读取设置文件中的其余配置
     */
    public BotFrameConfig load(BotFrameConfig template) {
        Path settingsPath = template.resolveSettingsFile();
        if (!Files.exists(settingsPath)) {
            log.warn("Settings file not found: {}, using defaults", settingsPath.toAbsolutePath());
            return template;
        }

        Map<String, Object> root;
        try (InputStream in = Files.newInputStream(settingsPath)) {
            root = YamlDocuments.load(in);
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationException("Failed to read settings file: " + settingsPath, e);
        }

        try {
            BotFrameConfig config = apply(template, root);
            log.info("Settings loaded from {}", settingsPath.toAbsolutePath());
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Malformed settings file " + settingsPath + ": " + e.getMessage(), e);
        }
    }

    BotFrameConfig apply(BotFrameConfig template, Map<String, Object> root) {
        BotFrameConfig.BotFrameConfigBuilder builder = template.toBuilder();

        Map<String, Object> plugins = YamlDocuments.asMap(root.get(PLUGINS));
        EnablementPolicy defaults = EnablementPolicy.defaults();
        builder.enablementPolicy(EnablementPolicy.builder()
                .services(parseKindPolicy(plugins.get("services"), defaults.getServices().isDefaultEnabled()))
                .utilities(parseKindPolicy(plugins.get("utilities"), defaults.getUtilities().isDefaultEnabled()))
                .build());

        Map<String, Object> shutdown = YamlDocuments.asMap(root.get(SHUTDOWN));
        builder.pluginShutdownTimeoutSeconds(YamlDocuments.asDouble(
                shutdown.get("plugin_shutdown_timeout"), template.getPluginShutdownTimeoutSeconds()));
        builder.backgroundTasksTimeoutSeconds(YamlDocuments.asDouble(
                shutdown.get("background_tasks_timeout"), template.getBackgroundTasksTimeoutSeconds()));

        Map<String, Object> planner = YamlDocuments.asMap(root.get(PLANNER));
        builder.disabledUtilityInvalidatesDependents(YamlDocuments.asBoolean(
                planner.get("disabled_utility_invalidates_dependents"),
                template.isDisabledUtilityInvalidatesDependents()));

        Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
        root.forEach((key, value) -> {
            if (!RESERVED_SECTIONS.contains(key) && value instanceof Map) {
                sections.put(key, YamlDocuments.asMap(value));
            }
        });
        builder.pluginSections(sections);

        return builder.build();
    }

    private KindPolicy parseKindPolicy(Object node, boolean defaultEnabled) {
        Map<String, Object> section = YamlDocuments.asMap(node);
        return KindPolicy.builder()
                .disabled(YamlDocuments.asStringSet(section.get("disabled")))
                .enabled(YamlDocuments.asStringSet(section.get("enabled")))
                .defaultEnabled(YamlDocuments.asBoolean(section.get("default_enabled"), defaultEnabled))
                .build();
    }
}
