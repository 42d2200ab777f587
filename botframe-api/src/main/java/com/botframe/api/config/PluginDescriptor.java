package com.botframe.api.config;

import com.botframe.api.plugin.PluginKind;
import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 对应插件目录下 config.yaml 的内容
 * 作为内核与插件之间的描述契约
 */
@Getter
@Setter
public class PluginDescriptor implements Serializable {

    // === 基础元数据 ===
    private String name;
    private String description = "";
    private PluginKind kind;

    /**
     * 插件所在目录
     */
    private transient Path location;

    // === 运行时配置 ===
    private boolean enabled = true;
    private boolean singleton = false;

    /**
     * 显式指定的工厂类全限定名，可选
     */
    private String factory;

    /**
     * 声明的依赖名（原样保留，包括图构建时被丢弃的无效目标）
     */
    private Set<String> dependencies = new LinkedHashSet<>();

    // === 内核不解析的元数据 ===
    private Map<String, Object> settings = new HashMap<>();
    private Map<String, Object> methods = new HashMap<>();
    private Map<String, Object> actions = new HashMap<>();
    private List<Object> features = new ArrayList<>();

    public boolean isUtility() {
        return kind == PluginKind.UTILITY;
    }

    public boolean isService() {
        return kind == PluginKind.SERVICE;
    }

    /**
     * 验证
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Plugin name cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Plugin kind cannot be null: " + name);
        }
    }

    @Override
    public String toString() {
        return String.format("PluginDescriptor{name='%s', kind=%s, singleton=%s}", name, kind, singleton);
    }
}
