package com.botframe.core.kernel;

import com.botframe.api.plugin.PluginFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * 插件工厂注册表：规范化插件名 -> 工厂
 * <p>
 * 宿主类路径上的注册表来自 {@code META-INF/services/com.botframe.api.plugin.PluginFactory}，
 * 在构建/打包时确定，运行时不做类名猜测。
 */
@Slf4j
public class PluginFactoryRegistry {

    private final Map<String, PluginFactory<?>> factories = new LinkedHashMap<>();

    /**
     * 读取指定类加载器可见的全部工厂声明
     */
    @SuppressWarnings("rawtypes")
    public static PluginFactoryRegistry fromServiceLoader(ClassLoader classLoader) {
        PluginFactoryRegistry registry = new PluginFactoryRegistry();
        ServiceLoader<PluginFactory> loader = ServiceLoader.load(PluginFactory.class, classLoader);
        for (ServiceLoader.Provider<PluginFactory> provider : loader.stream().toList()) {
            try {
                registry.register(provider.get());
            } catch (ServiceConfigurationError e) {
                log.error("Failed to instantiate plugin factory {}", provider.type().getName(), e);
            }
        }
        log.info("Plugin factory registry loaded: {} entries", registry.size());
        return registry;
    }

    public PluginFactoryRegistry register(PluginFactory<?> factory) {
        String key = normalize(factory.name());
        PluginFactory<?> previous = factories.putIfAbsent(key, factory);
        if (previous != null && previous != factory) {
            log.warn("Duplicate factory for plugin [{}]: {} ignored, keeping {}",
                    factory.name(), factory.getClass().getName(), previous.getClass().getName());
        }
        return this;
    }

    public Optional<PluginFactory<?>> find(String pluginName) {
        return Optional.ofNullable(factories.get(normalize(pluginName)));
    }

    public Map<String, PluginFactory<?>> getFactories() {
        return Collections.unmodifiableMap(factories);
    }

    public int size() {
        return factories.size();
    }

    /**
     * 规范化插件名：忽略大小写、下划线与中划线（telegram_api == TelegramApi）
     */
    public static String normalize(String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
