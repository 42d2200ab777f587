package com.botframe.core.loader;

import com.botframe.api.config.PluginDescriptor;
import com.botframe.api.plugin.PluginKind;
import com.botframe.core.config.YamlDocuments;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 解析插件目录下的 config.yaml
 */
public class PluginManifestLoader {

    public static PluginDescriptor load(InputStream inputStream, PluginKind kind, Path location) {
        Map<String, Object> root = YamlDocuments.load(inputStream);

        PluginDescriptor descriptor = new PluginDescriptor();
        // 未声明 name 时使用目录名
        Object name = root.get("name");
        descriptor.setName(name != null ? String.valueOf(name).trim() : location.getFileName().toString());
        descriptor.setKind(kind);
        descriptor.setLocation(location);

        Object description = root.get("description");
        if (description != null) {
            descriptor.setDescription(String.valueOf(description));
        }
        descriptor.setEnabled(YamlDocuments.asBoolean(root.get("enabled"), true));
        descriptor.setSingleton(YamlDocuments.asBoolean(root.get("singleton"), false));

        Object factory = root.get("factory");
        if (factory != null) {
            descriptor.setFactory(String.valueOf(factory).trim());
        }

        descriptor.setDependencies(parseDependencies(root.get("dependencies")));

        descriptor.setSettings(YamlDocuments.asMap(root.get("settings")));
        descriptor.setMethods(YamlDocuments.asMap(root.get("methods")));
        descriptor.setActions(YamlDocuments.asMap(root.get("actions")));
        descriptor.getFeatures().addAll(YamlDocuments.asStringList(root.get("features")));

        descriptor.validate();
        return descriptor;
    }

    /**
     * 支持两种写法：
     * <pre>
     * dependencies: [a, b]
     * dependencies:
     *   utilities: [a, b]
     * </pre>
     */
    private static Set<String> parseDependencies(Object node) {
        if (node == null) {
            return new LinkedHashSet<>();
        }
        if (node instanceof Map) {
            Map<String, Object> section = YamlDocuments.asMap(node);
            return YamlDocuments.asStringSet(section.get(PluginKind.UTILITY.getDirectory()));
        }
        return YamlDocuments.asStringSet(node);
    }

}
