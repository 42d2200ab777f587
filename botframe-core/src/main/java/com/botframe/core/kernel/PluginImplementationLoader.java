package com.botframe.core.kernel;

import com.botframe.api.config.PluginDescriptor;
import com.botframe.api.plugin.PluginFactory;
import com.botframe.core.classloader.DefaultPluginLoaderFactory;
import com.botframe.core.exception.PluginLoadException;
import com.botframe.core.spi.PluginLoaderFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 定位插件实现
 * <p>
 * 查找顺序：
 * 1. 描述文件中显式声明的 factory 类
 * 2. 宿主注册表中同名的工厂
 * 3. 插件目录中的实现 jar：优先 {@code <name>.jar}，否则按文件名排序取第一个；
 * 读取 jar 自带的工厂声明，优先同名工厂，否则取第一个
 */
@Slf4j
public class PluginImplementationLoader {

    private static final String JAR_SUFFIX = ".jar";

    private final PluginFactoryRegistry registry;
    private final PluginLoaderFactory loaderFactory;
    private final ClassLoader parent;

    // 为插件 jar 创建的类加载器，关闭内核时释放
    private final Map<String, ClassLoader> pluginLoaders = new ConcurrentHashMap<>();

    public PluginImplementationLoader(PluginFactoryRegistry registry) {
        this(registry, new DefaultPluginLoaderFactory(), PluginImplementationLoader.class.getClassLoader());
    }

    public PluginImplementationLoader(PluginFactoryRegistry registry, PluginLoaderFactory loaderFactory, ClassLoader parent) {
        this.registry = registry;
        this.loaderFactory = loaderFactory;
        this.parent = parent;
    }

    /**
     * @throws PluginLoadException 找不到实现或加载失败
     */
    public PluginFactory<?> load(PluginDescriptor descriptor) {
        String name = descriptor.getName();

        if (descriptor.getFactory() != null && !descriptor.getFactory().isBlank()) {
            return loadDeclaredFactory(descriptor);
        }

        Optional<PluginFactory<?>> registered = registry.find(name);
        if (registered.isPresent()) {
            log.debug("[{}] Using registered factory {}", name, registered.get().getClass().getName());
            return registered.get();
        }

        Optional<Path> jar = findImplementationJar(descriptor);
        if (jar.isPresent()) {
            return loadFromJar(descriptor, jar.get());
        }

        throw new PluginLoadException("No implementation found for plugin: " + name);
    }

    private PluginFactory<?> loadDeclaredFactory(PluginDescriptor descriptor) {
        String className = descriptor.getFactory();
        ClassLoader loader = findImplementationJar(descriptor)
                .map(jar -> pluginLoader(descriptor.getName(), jar))
                .orElse(parent);
        try {
            Class<?> type = Class.forName(className, true, loader);
            if (!PluginFactory.class.isAssignableFrom(type)) {
                throw new PluginLoadException("Class " + className + " does not implement " + PluginFactory.class.getName());
            }
            PluginFactory<?> factory = (PluginFactory<?>) type.getDeclaredConstructor().newInstance();
            log.debug("[{}] Using declared factory {}", descriptor.getName(), className);
            return factory;
        } catch (PluginLoadException e) {
            throw e;
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new PluginLoadException("Failed to load factory " + className + " for plugin " + descriptor.getName(), e);
        }
    }

    @SuppressWarnings("rawtypes")
    private PluginFactory<?> loadFromJar(PluginDescriptor descriptor, Path jar) {
        String name = descriptor.getName();
        ClassLoader loader = pluginLoader(name, jar);
        try {
            // 只取 jar 自己声明的工厂，父加载器可见的声明不算
            List<PluginFactory> own = ServiceLoader.load(PluginFactory.class, loader).stream()
                    .filter(provider -> provider.type().getClassLoader() == loader)
                    .map(ServiceLoader.Provider::get)
                    .collect(Collectors.toList());
            if (own.isEmpty()) {
                throw new PluginLoadException("No PluginFactory declared in " + jar);
            }
            String key = PluginFactoryRegistry.normalize(name);
            PluginFactory<?> factory = own.stream()
                    .filter(f -> PluginFactoryRegistry.normalize(f.name()).equals(key))
                    .findFirst()
                    .orElseGet(() -> {
                        log.warn("[{}] No factory named after the plugin in {}, using {}",
                                name, jar.getFileName(), own.get(0).getClass().getName());
                        return own.get(0);
                    });
            log.info("[{}] Loaded implementation from {}", name, jar.getFileName());
            return factory;
        } catch (PluginLoadException e) {
            throw e;
        } catch (Exception | LinkageError e) {
            throw new PluginLoadException("Failed to load plugin " + name + " from " + jar, e);
        }
    }

    /**
     * 约定：优先 {@code <name>.jar}，否则取排序后的第一个 jar
     */
    Optional<Path> findImplementationJar(PluginDescriptor descriptor) {
        Path location = descriptor.getLocation();
        if (location == null || !Files.isDirectory(location)) {
            return Optional.empty();
        }
        Path conventional = location.resolve(descriptor.getName() + JAR_SUFFIX);
        if (Files.isRegularFile(conventional)) {
            return Optional.of(conventional);
        }
        try (Stream<Path> files = Files.list(location)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JAR_SUFFIX))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            throw new PluginLoadException("Failed to list plugin directory " + location, e);
        }
    }

    private ClassLoader pluginLoader(String name, Path jar) {
        return pluginLoaders.computeIfAbsent(name, k -> {
            try {
                return loaderFactory.create(k, new URL[]{jar.toUri().toURL()}, parent);
            } catch (MalformedURLException e) {
                throw new PluginLoadException("Invalid plugin jar path " + jar, e);
            }
        });
    }

    /**
     * 关闭为插件 jar 创建的类加载器
     */
    public void releaseAll() {
        pluginLoaders.forEach((name, loader) -> {
            if (loader instanceof Closeable closeable) {
                try {
                    closeable.close();
                } catch (IOException e) {
                    log.warn("[{}] Failed to close plugin class loader", name, e);
                }
            }
        });
        pluginLoaders.clear();
    }
}
