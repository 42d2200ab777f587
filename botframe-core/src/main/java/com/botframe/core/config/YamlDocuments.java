package com.botframe.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML 文档读取与类型转换
 * 描述文件和设置文件都按无类型的 Map 读取，再由调用方按键取值
 */
public final class YamlDocuments {

    private YamlDocuments() {
    }

    /**
     * 读取 YAML 根节点，空文档返回空 Map
     *
     * @throws IllegalArgumentException 根节点不是映射
     */
    public static Map<String, Object> load(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);

        // 只构造基础类型，描述文件来自插件目录，不允许实例化任意类
        Yaml yaml = new Yaml(new SafeConstructor(options));

        Object root = yaml.load(inputStream);
        if (root == null) {
            return new LinkedHashMap<>();
        }
        if (!(root instanceof Map)) {
            throw new IllegalArgumentException("YAML root must be a mapping, got " + root.getClass().getSimpleName());
        }
        return asMap(root);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected a mapping, got " + value.getClass().getSimpleName());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    /**
     * 标量视为单元素列表，null 视为空列表
     */
    public static List<String> asStringList(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Iterable<?> iterable) {
            List<String> result = new ArrayList<>();
            for (Object item : iterable) {
                if (item != null) {
                    result.add(String.valueOf(item).trim());
                }
            }
            return result;
        }
        return List.of(String.valueOf(value).trim());
    }

    public static Set<String> asStringSet(Object value) {
        return new LinkedHashSet<>(asStringList(value));
    }

    public static boolean asBoolean(Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException("Expected a boolean, got '" + text + "'");
    }

    public static double asDouble(Object value, double defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number, got '" + value + "'", e);
        }
    }
}
