package com.botframe.api.plugin;

/**
 * 插件实现的注册入口
 * <p>
 * 每个插件通过 {@code META-INF/services/com.botframe.api.plugin.PluginFactory}
 * 声明自己的工厂，内核据此建立 "插件名 -> 工厂" 注册表，不再靠类名猜测实现类。
 *
 * @param <T> 插件实例类型
 * @author BotFrame
 */
public interface PluginFactory<T> {

    /**
     * 插件名，需与描述文件中的 name 一致（大小写、下划线、中划线不敏感）
     */
    String name();

    /**
     * 创建插件实例
     *
     * @param dependencies 已解析的依赖，未解析的依赖不会出现
     * @return 插件实例
     * @throws Exception 构造失败，内核会将其视为该插件的实例化错误
     */
    T create(Dependencies dependencies) throws Exception;
}
