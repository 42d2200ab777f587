package com.botframe.api.plugin;

import java.util.Locale;

/**
 * 插件种类
 * <p>
 * UTILITY: 向其他插件提供能力
 * <p>
 * SERVICE: 暴露长期运行入口，内核中没有其他插件依赖它
 */
public enum PluginKind {

    UTILITY("utilities"),
    SERVICE("services");

    /**
     * 插件树中对应的子目录名，同时也是配置文件中的分组键
     */
    private final String directory;

    PluginKind(String directory) {
        this.directory = directory;
    }

    public String getDirectory() {
        return directory;
    }

    public static PluginKind fromDirectory(String directory) {
        String key = directory.toLowerCase(Locale.ROOT);
        for (PluginKind kind : values()) {
            if (kind.directory.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown plugin kind: " + directory);
    }
}
