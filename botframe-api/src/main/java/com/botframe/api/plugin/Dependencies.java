package com.botframe.api.plugin;

import java.util.Optional;
import java.util.Set;

/**
 * 注入给插件工厂的依赖视图
 * <p>
 * 只包含成功解析的依赖；缺失的依赖不会出现在这里，
 * 插件需要自行决定缺少某个依赖时如何降级。
 *
 * @author BotFrame
 */
public interface Dependencies {

    /**
     * 按名称获取依赖实例
     */
    Optional<Object> get(String name);

    /**
     * 按名称获取依赖实例并转换为指定类型，类型不符时返回空
     */
    default <T> Optional<T> get(String name, Class<T> type) {
        return get(name).filter(type::isInstance).map(type::cast);
    }

    /**
     * 获取必需依赖，缺失时抛出 IllegalStateException
     */
    default <T> T require(String name, Class<T> type) {
        return get(name, type).orElseThrow(() ->
                new IllegalStateException("Required dependency not available: " + name));
    }

    boolean contains(String name);

    /**
     * 已解析的依赖名称
     */
    Set<String> names();
}
