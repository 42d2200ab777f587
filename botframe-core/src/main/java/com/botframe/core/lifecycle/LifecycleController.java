package com.botframe.core.lifecycle;

import com.botframe.api.plugin.LongRunning;
import com.botframe.core.config.BootstrapNames;
import com.botframe.core.config.BotFrameConfig;
import com.botframe.core.kernel.InstanceKernel;
import com.botframe.core.kernel.PluginFactoryRegistry;
import com.botframe.core.kernel.PluginImplementationLoader;
import com.botframe.core.loader.PluginDiscoveryService;
import com.botframe.core.plan.StartupPlan;
import com.botframe.core.plan.StartupPlanner;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 生命周期控制器
 * <p>
 * 职责：
 * 1. 依次构建 发现 -> 计划 -> 内核，并为每个带运行入口的服务启动后台任务
 * 2. 阻塞等待关闭触发（信号或 requestShutdown）
 * 3. 两阶段、各自限时的关闭：先内核销毁钩子，再后台任务，最后释放插件类加载器
 * <p>
 * 第二次终止信号在关闭完成前到达时立即终止进程。
 */
@Slf4j
public class LifecycleController {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final BotFrameConfig config;
    private final PluginFactoryRegistry factoryRegistry;
    private final ExitHandler exitHandler;

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile ControllerState state = ControllerState.CREATED;

    private final CountDownLatch shutdownTrigger = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicInteger signalCount = new AtomicInteger();

    private final ExecutorService serviceExecutor;
    private final List<BackgroundTask> backgroundTasks = Collections.synchronizedList(new ArrayList<>());

    private PluginDiscoveryService discovery;
    private StartupPlanner planner;
    private InstanceKernel kernel;

    public LifecycleController(BotFrameConfig config) {
        this(config, PluginFactoryRegistry.fromServiceLoader(LifecycleController.class.getClassLoader()),
                ExitHandler.system());
    }

    public LifecycleController(BotFrameConfig config, PluginFactoryRegistry factoryRegistry, ExitHandler exitHandler) {
        this.config = config;
        this.factoryRegistry = factoryRegistry;
        this.exitHandler = exitHandler;
        this.serviceExecutor = Executors.newCachedThreadPool(namedDaemonFactory("botframe-service-"));
    }

    // ==================== 启动 ====================

    /**
     * 构建组件并启动服务
     * <p>
     * 任何异常都会先尝试关闭，再以状态码 1 退出进程。
     *
     * @return 是否启动成功
     */
    public boolean startup() {
        if (!transition(ControllerState.CREATED, ControllerState.STARTING)) {
            log.warn("BotFrame cannot start from state {}", state);
            return false;
        }

        long start = System.currentTimeMillis();
        log.info("Starting BotFrame...");
        try {
            discovery = new PluginDiscoveryService(config);
            discovery.discover();

            planner = new StartupPlanner(config, discovery);
            StartupPlan plan = planner.getStartupPlan();

            kernel = new InstanceKernel(discovery, new PluginImplementationLoader(factoryRegistry), bootstrapInstances());
            kernel.initialize(plan);

            startServices();

            transition(ControllerState.STARTING, ControllerState.RUNNING);
            log.info("BotFrame started in {} ms", System.currentTimeMillis() - start);
            return true;
        } catch (Exception | Error e) {
            log.error("Error starting BotFrame: {}", e.getMessage(), e);
            shutdown();
            exitHandler.exit(EXIT_FAILURE);
            return false;
        }
    }

    private Map<String, Object> bootstrapInstances() {
        Map<String, Object> instances = new LinkedHashMap<>();
        instances.put(BootstrapNames.LOGGER, LoggerFactory.getILoggerFactory());
        instances.put(BootstrapNames.PLUGINS_MANAGER, discovery);
        instances.put(BootstrapNames.SETTINGS_MANAGER, planner);
        return instances;
    }

    private void startServices() {
        Map<String, Object> services = kernel.getAllServices();
        if (services.isEmpty()) {
            log.info("No services to start");
            return;
        }
        log.info("Services found: {}", services.size());

        services.forEach((name, instance) -> {
            if (instance instanceof LongRunning entryPoint) {
                log.info("[{}] Starting service", name);
                backgroundTasks.add(BackgroundTask.start(name, entryPoint, serviceExecutor));
            } else {
                log.warn("[{}] Service has no run entry point", name);
            }
        });
        log.info("Background tasks started: {}", backgroundTasks.size());
    }

    // ==================== 运行 ====================

    /**
     * 阻塞直到关闭被触发，然后执行关闭流程
     *
     * @return 进程退出码
     */
    public int run() {
        if (state != ControllerState.RUNNING) {
            log.error("BotFrame is not running (state={})", state);
            return EXIT_FAILURE;
        }
        try {
            shutdownTrigger.await();
        } catch (InterruptedException e) {
            log.info("Main thread interrupted, shutting down");
            Thread.currentThread().interrupt();
        }
        shutdown();
        return EXIT_OK;
    }

    /**
     * 触发关闭，run() 随之返回
     */
    public void requestShutdown() {
        if (shutdownTrigger.getCount() > 0) {
            log.info("Shutdown requested");
            shutdownTrigger.countDown();
        }
    }

    /**
     * 终止信号入口：第一次触发优雅关闭，关闭完成前的第二次立即终止进程
     */
    public void onTerminationSignal(String signal) {
        int count = signalCount.incrementAndGet();
        if (count == 1) {
            log.info("Received signal {}, starting graceful shutdown...", signal);
            requestShutdown();
        } else if (state != ControllerState.STOPPED) {
            log.warn("Received signal {} again during shutdown, halting immediately", signal);
            exitHandler.halt(EXIT_FAILURE);
        }
    }

    // ==================== 关闭 ====================

    /**
     * 两阶段关闭，重复调用只执行一次
     */
    public void shutdown() {
        stateLock.lock();
        try {
            if (state == ControllerState.SHUTTING_DOWN || state.isTerminal()) {
                return;
            }
            state = ControllerState.SHUTTING_DOWN;
        } finally {
            stateLock.unlock();
        }
        shutdownTrigger.countDown();

        long start = System.currentTimeMillis();
        log.info("Shutting down BotFrame...");
        try {
            shutdownKernel();
            shutdownBackgroundTasks();
            releaseClassLoaders();
        } finally {
            setState(ControllerState.STOPPED);
            stopped.countDown();
            log.info("BotFrame stopped in {} ms", System.currentTimeMillis() - start);
        }
    }

    /**
     * 第一阶段：在独立线程中执行内核关闭，超时即放弃等待
     */
    private void shutdownKernel() {
        if (kernel == null) {
            return;
        }
        long timeout = config.pluginShutdownTimeoutMillis();
        ExecutorService worker = Executors.newSingleThreadExecutor(namedDaemonFactory("botframe-kernel-shutdown-"));
        Future<?> future = worker.submit(kernel::shutdown);
        try {
            future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Kernel shutdown did not finish within {} ms, abandoning", timeout);
            future.cancel(true);
        } catch (ExecutionException e) {
            log.error("Error during kernel shutdown: {}", e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for kernel shutdown");
            future.cancel(true);
            Thread.currentThread().interrupt();
        } finally {
            worker.shutdownNow();
        }
    }

    /**
     * 第二阶段：取消全部后台任务，在截止时间内等待退出，之后不再等待
     */
    private void shutdownBackgroundTasks() {
        List<BackgroundTask> tasks;
        synchronized (backgroundTasks) {
            tasks = new ArrayList<>(backgroundTasks);
        }
        if (tasks.isEmpty()) {
            serviceExecutor.shutdownNow();
            return;
        }

        log.info("Cancelling {} background tasks...", tasks.size());
        tasks.forEach(BackgroundTask::cancel);

        long timeout = config.backgroundTasksTimeoutMillis();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeout);
        List<String> pending = new ArrayList<>();
        try {
            for (BackgroundTask task : tasks) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (!task.awaitTermination(remaining)) {
                    pending.add(task.getServiceName());
                }
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for background tasks");
            Thread.currentThread().interrupt();
        }

        if (!pending.isEmpty()) {
            log.warn("Background tasks still running after {} ms, force cancelling: {}", timeout, pending);
        }
        serviceExecutor.shutdownNow();
    }

    /**
     * 后台任务全部处理完后才关闭插件类加载器
     */
    private void releaseClassLoaders() {
        if (kernel != null) {
            kernel.releaseClassLoaders();
        }
    }

    /**
     * 等待关闭流程结束
     *
     * @return 超时前是否已进入 STOPPED
     */
    public boolean awaitStopped(long timeoutMillis) throws InterruptedException {
        return stopped.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    // ==================== 状态 ====================

    private boolean transition(ControllerState from, ControllerState to) {
        stateLock.lock();
        try {
            if (state != from) {
                return false;
            }
            state = to;
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private void setState(ControllerState newState) {
        stateLock.lock();
        try {
            state = newState;
        } finally {
            stateLock.unlock();
        }
    }

    private static ThreadFactory namedDaemonFactory(String prefix) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + threadNumber.getAndIncrement());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Thread {} failed: {}", thread.getName(), e.getMessage()));
            return t;
        };
    }

    public ControllerState getState() {
        return state;
    }

    public List<BackgroundTask> getBackgroundTasks() {
        synchronized (backgroundTasks) {
            return List.copyOf(backgroundTasks);
        }
    }

    public PluginDiscoveryService getDiscovery() {
        return discovery;
    }

    public StartupPlanner getPlanner() {
        return planner;
    }

    public InstanceKernel getKernel() {
        return kernel;
    }
}
