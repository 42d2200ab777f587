package com.botframe.core.kernel;

import com.botframe.api.config.PluginDescriptor;
import com.botframe.api.plugin.PluginFactory;
import com.botframe.api.plugin.PluginKind;
import com.botframe.api.plugin.Teardown;
import com.botframe.core.config.BootstrapNames;
import com.botframe.core.exception.PluginInstantiationException;
import com.botframe.core.exception.PluginLoadException;
import com.botframe.core.loader.PluginDiscoveryService;
import com.botframe.core.plan.StartupPlan;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 实例内核
 * <p>
 * 职责：
 * 1. 按启动计划加载插件实现并注入依赖
 * 2. 单例缓存实例，非单例只缓存工厂，每次获取时重新创建
 * 3. 关闭时调用销毁钩子并清空全部缓存，之后可以再次 initialize
 * <p>
 * 四张缓存表由同一把锁保护。
 */
@Slf4j
public class InstanceKernel {

    /**
     * 注入给插件的子 logger 名称前缀
     */
    public static final String PLUGIN_LOGGER_PREFIX = "botframe.plugin.";

    private final PluginDiscoveryService discovery;
    private final PluginImplementationLoader implementationLoader;
    private final Map<String, Object> bootstrapInstances;

    private final ReentrantLock cacheLock = new ReentrantLock();

    // ==================== 缓存 ====================
    private final Map<String, Object> utilityInstances = new LinkedHashMap<>();
    private final Map<String, PluginFactory<?>> utilityFactories = new LinkedHashMap<>();
    private final Map<String, Object> serviceInstances = new LinkedHashMap<>();
    private final Map<String, PluginFactory<?>> serviceFactories = new LinkedHashMap<>();

    private boolean initialized = false;

    /**
     * @param bootstrapInstances 宿主预建的基础工具，按名称注入，须覆盖配置中的全部基础工具名
     */
    public InstanceKernel(PluginDiscoveryService discovery,
                          PluginImplementationLoader implementationLoader,
                          Map<String, Object> bootstrapInstances) {
        this.discovery = discovery;
        this.implementationLoader = implementationLoader;
        this.bootstrapInstances = new LinkedHashMap<>(bootstrapInstances);
    }

    // ==================== 初始化 ====================

    /**
     * 按计划初始化：基础工具 -> dependency_order 中的工具 -> enabled_services 中的服务
     * <p>
     * 单个插件失败只记录日志，不影响其他插件。重复调用（未 shutdown）不做任何事。
     */
    public void initialize(StartupPlan plan) {
        cacheLock.lock();
        try {
            if (initialized) {
                log.debug("Kernel already initialized, skipping");
                return;
            }
            log.info("Initializing kernel: {} utilities, {} services",
                    plan.dependencyOrder().size(), plan.totalServices());

            utilityInstances.putAll(bootstrapInstances);

            for (String utility : plan.dependencyOrder()) {
                register(utility, PluginKind.UTILITY);
            }
            for (String service : plan.enabledServices()) {
                register(service, PluginKind.SERVICE);
            }
            initialized = true;

            log.info("Kernel initialized: {}", getStats());
        } finally {
            cacheLock.unlock();
        }
    }

    private void register(String name, PluginKind kind) {
        Optional<PluginDescriptor> descriptor = discovery.getDescriptor(name);
        if (descriptor.isEmpty()) {
            log.error("[{}] Not found among discovered plugins, skipped", name);
            return;
        }
        if (descriptor.get().getKind() != kind) {
            log.error("[{}] Expected a {} but found a {}, skipped", name, kind, descriptor.get().getKind());
            return;
        }
        try {
            PluginFactory<?> factory = load(descriptor.get());
            if (descriptor.get().isSingleton()) {
                Object instance = createInstance(name, factory, resolver(false));
                instancesOf(kind).put(name, instance);
                log.info("[{}] {} created (singleton)", name, kindLabel(kind));
            } else {
                factoriesOf(kind).put(name, factory);
                log.info("[{}] {} registered for on-demand creation", name, kindLabel(kind));
            }
        } catch (RuntimeException | LinkageError e) {
            // 单个插件不可用，其余插件继续
            log.error("[{}] Failed to register {}: {}", name, kindLabel(kind), e.getMessage(), e);
        }
    }

    /**
     * 加载插件实现
     *
     * @throws PluginLoadException 找不到或无法加载实现
     */
    public PluginFactory<?> load(PluginDescriptor descriptor) {
        return implementationLoader.load(descriptor);
    }

    // ==================== 实例化 ====================

    /**
     * 解析声明的依赖并调用工厂创建实例
     * <p>
     * logger 依赖注入以插件命名的子 logger；解析不到的依赖跳过并记录警告。
     *
     * @throws PluginInstantiationException 工厂抛出异常、链接错误或返回 null
     */
    public Object createInstance(String name, PluginFactory<?> factory, Function<String, Optional<Object>> resolver) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (String dep : discovery.getDependencies(name)) {
            if (BootstrapNames.LOGGER.equals(dep) && !BootstrapNames.LOGGER.equals(name)) {
                resolved.put(dep, LoggerFactory.getLogger(PLUGIN_LOGGER_PREFIX + name));
                continue;
            }
            Optional<Object> instance = resolver.apply(dep);
            if (instance.isPresent()) {
                resolved.put(dep, instance.get());
            } else {
                log.warn("[{}] Dependency {} not found - will be skipped", name, dep);
            }
        }

        Object instance;
        try {
            instance = factory.create(new KernelDependencies(resolved));
        } catch (Exception | LinkageError e) {
            log.error("[{}] Error creating instance: {}", name, e.toString());
            throw new PluginInstantiationException(name, e);
        }
        if (instance == null) {
            throw new PluginInstantiationException(name,
                    new IllegalStateException("Factory " + factory.getClass().getName() + " returned null"));
        }
        return instance;
    }

    private Function<String, Optional<Object>> resolver(boolean onDemand) {
        // 服务和工具都只能依赖工具
        return onDemand ? this::getOnDemand : this::getUtility;
    }

    // ==================== 查询 ====================

    /**
     * 按名称获取插件实例：单例返回缓存实例，非单例每次新建
     *
     * @throws PluginInstantiationException 非单例创建失败
     */
    public Optional<Object> get(String name) {
        cacheLock.lock();
        try {
            Optional<Object> utility = getUtility(name);
            return utility.isPresent() ? utility : getService(name);
        } finally {
            cacheLock.unlock();
        }
    }

    public <T> Optional<T> get(String name, Class<T> type) {
        return get(name).filter(type::isInstance).map(type::cast);
    }

    public Optional<Object> getUtility(String name) {
        return lookup(name, PluginKind.UTILITY);
    }

    public Optional<Object> getService(String name) {
        return lookup(name, PluginKind.SERVICE);
    }

    private Optional<Object> lookup(String name, PluginKind kind) {
        cacheLock.lock();
        try {
            Object instance = instancesOf(kind).get(name);
            if (instance != null) {
                return Optional.of(instance);
            }
            PluginFactory<?> factory = factoriesOf(kind).get(name);
            if (factory != null) {
                return Optional.of(createInstance(name, factory, resolver(false)));
            }
            return Optional.empty();
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * 获取工具，即使它不在启动计划中
     * <p>
     * 未注册时按完整的加载+创建路径构造（依赖同样按需获取），并补登记到缓存。
     * 检查与创建在同一把锁内完成。失败时记录日志并返回空。
     */
    public Optional<Object> getOnDemand(String name) {
        cacheLock.lock();
        try {
            Optional<Object> existing = getUtility(name);
            if (existing.isPresent()) {
                return existing;
            }

            Optional<PluginDescriptor> descriptor = discovery.getDescriptor(name);
            if (descriptor.isEmpty()) {
                log.warn("[{}] Utility not found among discovered plugins", name);
                return Optional.empty();
            }
            if (!descriptor.get().isUtility()) {
                log.warn("[{}] Is a service, only utilities can be obtained on demand", name);
                return Optional.empty();
            }

            PluginFactory<?> factory = load(descriptor.get());
            Object instance = createInstance(name, factory, resolver(true));
            if (descriptor.get().isSingleton()) {
                utilityInstances.put(name, instance);
                log.info("[{}] Utility created on demand and registered as singleton", name);
            } else {
                utilityFactories.put(name, factory);
                log.info("[{}] Utility registered on demand for on-demand creation", name);
            }
            return Optional.of(instance);
        } catch (RuntimeException | LinkageError e) {
            log.error("[{}] Error creating utility on demand: {}", name, e.getMessage(), e);
            return Optional.empty();
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * 已缓存的工具实例（含基础工具）
     */
    public Map<String, Object> getAllUtilities() {
        cacheLock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(utilityInstances));
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * 全部服务：单例取缓存，非单例为每个新建一个实例（创建失败的跳过）
     */
    public Map<String, Object> getAllServices() {
        cacheLock.lock();
        try {
            Map<String, Object> all = new LinkedHashMap<>(serviceInstances);
            serviceFactories.forEach((name, factory) -> {
                try {
                    all.put(name, createInstance(name, factory, resolver(false)));
                } catch (PluginInstantiationException e) {
                    log.error("[{}] Error creating service instance: {}", name, e.getMessage(), e);
                }
            });
            return Collections.unmodifiableMap(all);
        } finally {
            cacheLock.unlock();
        }
    }

    public boolean isInitialized() {
        cacheLock.lock();
        try {
            return initialized;
        } finally {
            cacheLock.unlock();
        }
    }

    // ==================== 关闭 ====================

    /**
     * 依次调用工具、服务的销毁钩子，单个钩子失败不影响其他钩子，最后清空全部缓存
     * <p>
     * 钩子在锁外执行；可重复调用。插件类加载器不在这里关闭，见 {@link #releaseClassLoaders()}。
     */
    public void shutdown() {
        List<Map.Entry<String, Object>> utilities;
        List<Map.Entry<String, Object>> services;
        cacheLock.lock();
        try {
            utilities = new ArrayList<>(utilityInstances.entrySet());
            services = new ArrayList<>(serviceInstances.entrySet());
        } finally {
            cacheLock.unlock();
        }

        log.info("Shutting down kernel...");
        try {
            for (Map.Entry<String, Object> entry : utilities) {
                invokeTeardown(entry.getKey(), entry.getValue(), "utility");
            }
            for (Map.Entry<String, Object> entry : services) {
                invokeTeardown(entry.getKey(), entry.getValue(), "service");
            }
        } finally {
            cacheLock.lock();
            try {
                utilityInstances.clear();
                utilityFactories.clear();
                serviceInstances.clear();
                serviceFactories.clear();
                initialized = false;
            } finally {
                cacheLock.unlock();
            }
        }
        log.info("Kernel terminated");
    }

    /**
     * 关闭为插件 jar 创建的类加载器
     * <p>
     * 与 shutdown 分开：插件的后台任务退出前仍可能从自己的 jar 加载类或资源。
     */
    public void releaseClassLoaders() {
        implementationLoader.releaseAll();
        log.debug("Plugin class loaders released");
    }

    private void invokeTeardown(String name, Object instance, String label) {
        if (!(instance instanceof Teardown teardown)) {
            return;
        }
        try {
            log.info("[{}] Shutting down {}", name, label);
            teardown.shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while shutting down {}", name, label);
        } catch (Exception e) {
            log.error("[{}] Error shutting down {}: {}", name, label, e.getMessage(), e);
        }
    }

    // ==================== 内部 ====================

    private Map<String, Object> instancesOf(PluginKind kind) {
        return kind == PluginKind.UTILITY ? utilityInstances : serviceInstances;
    }

    private Map<String, PluginFactory<?>> factoriesOf(PluginKind kind) {
        return kind == PluginKind.UTILITY ? utilityFactories : serviceFactories;
    }

    private static String kindLabel(PluginKind kind) {
        return kind == PluginKind.UTILITY ? "Utility" : "Service";
    }

    public CacheStats getStats() {
        cacheLock.lock();
        try {
            return new CacheStats(utilityInstances.size(), utilityFactories.size(),
                    serviceInstances.size(), serviceFactories.size());
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * 缓存统计
     */
    public record CacheStats(int utilityInstances, int utilityFactories,
                             int serviceInstances, int serviceFactories) {

        public boolean isEmpty() {
            return utilityInstances + utilityFactories + serviceInstances + serviceFactories == 0;
        }

        @Override
        @NonNull
        public String toString() {
            return String.format("CacheStats{utilities=%d+%d, services=%d+%d}",
                    utilityInstances, utilityFactories, serviceInstances, serviceFactories);
        }
    }
}
