package com.botframe.core.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * BotFrame Core 全局配置对象
 * <p>
 * 职责：作为内核的唯一配置入口，由 {@link BotFrameConfigLoader} 从 settings.yaml 构建，
 * 测试中直接通过 builder 构造。
 */
@Data
@Builder(toBuilder = true)
@ToString
public class BotFrameConfig {

    // ================= 目录布局 =================

    /**
     * 项目根目录，插件目录与设置文件都相对它解析
     */
    @Builder.Default
    private String projectRoot = ".";

    /**
     * 插件存放根目录，下设 utilities 与 services 两个子目录
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 插件描述文件名，存在该文件的目录即视为插件
     */
    @Builder.Default
    private String descriptorFileName = "config.yaml";

    /**
     * 全局设置文件（相对项目根目录）
     */
    @Builder.Default
    private String settingsFile = "config/settings.yaml";

    // ================= 启动计划 =================

    /**
     * 启用策略
     */
    @Builder.Default
    private EnablementPolicy enablementPolicy = EnablementPolicy.defaults();

    /**
     * 由宿主在内核之前创建的工具，始终从 required_utilities 中扣除
     */
    @Builder.Default
    private List<String> bootstrapUtilities = List.of(
            BootstrapNames.LOGGER, BootstrapNames.PLUGINS_MANAGER, BootstrapNames.SETTINGS_MANAGER);

    /**
     * 被策略禁用的工具是否让依赖它的服务失效
     * <p>
     * true: 与缺失依赖同等处理，服务从 enabled_services 中移除
     * <p>
     * false: 只从 required_utilities 中剔除该工具，服务照常启动
     */
    @Builder.Default
    private boolean disabledUtilityInvalidatesDependents = true;

    // ================= 关闭 =================

    /**
     * 第一阶段：内核销毁钩子的超时时间（秒）
     */
    @Builder.Default
    private double pluginShutdownTimeoutSeconds = 3.0;

    /**
     * 第二阶段：后台任务退出的超时时间（秒）
     */
    @Builder.Default
    private double backgroundTasksTimeoutSeconds = 2.0;

    // ================= 插件设置 =================

    /**
     * settings.yaml 中除保留键以外的顶层段落，键为插件名
     */
    @Builder.Default
    private Map<String, Map<String, Object>> pluginSections = Collections.emptyMap();

    public Path resolvePluginHome() {
        return Paths.get(projectRoot).resolve(pluginHome).normalize();
    }

    public Path resolveSettingsFile() {
        return Paths.get(projectRoot).resolve(settingsFile).normalize();
    }

    public long pluginShutdownTimeoutMillis() {
        return toMillis(pluginShutdownTimeoutSeconds);
    }

    public long backgroundTasksTimeoutMillis() {
        return toMillis(backgroundTasksTimeoutSeconds);
    }

    private static long toMillis(double seconds) {
        return Math.max(0L, Math.round(seconds * 1000));
    }
}
