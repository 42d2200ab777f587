package com.botframe.core.config;

/**
 * 宿主预先创建的基础工具名
 */
public final class BootstrapNames {

    /**
     * 日志设施，注入时会替换为按插件命名的子日志器
     */
    public static final String LOGGER = "logger";

    public static final String PLUGINS_MANAGER = "plugins_manager";

    public static final String SETTINGS_MANAGER = "settings_manager";

    private BootstrapNames() {
    }
}
