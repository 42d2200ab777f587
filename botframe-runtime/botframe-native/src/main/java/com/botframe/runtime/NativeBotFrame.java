package com.botframe.runtime;

import com.botframe.core.config.BotFrameConfig;
import com.botframe.core.config.BotFrameConfigLoader;
import com.botframe.core.kernel.PluginFactoryRegistry;
import com.botframe.core.lifecycle.ExitHandler;
import com.botframe.core.lifecycle.LifecycleController;
import lombok.extern.slf4j.Slf4j;

/**
 * BotFrame Native 启动器
 * <p>
 * 读取 PROJECT_ROOT 下的 config/settings.yaml，启动内核并阻塞到收到终止信号。
 */
@Slf4j
public class NativeBotFrame {

    public static void main(String[] args) {
        ExitHandler exitHandler = ExitHandler.system();
        int status;
        try {
            BotFrameConfig config = new BotFrameConfigLoader().load(BotFrameConfigLoader.resolveProjectRoot());
            log.info("Project root: {}", config.getProjectRoot());

            LifecycleController controller = createController(config, exitHandler);
            TerminationSignals.install(controller::onTerminationSignal, () -> awaitShutdown(controller, config));
            status = run(controller);
        } catch (Exception e) {
            log.error("BotFrame terminated with error: {}", e.getMessage(), e);
            status = LifecycleController.EXIT_FAILURE;
        }
        exitHandler.exit(status);
    }

    /**
     * 启动并阻塞到关闭完成
     *
     * @return 进程退出码
     */
    static int run(LifecycleController controller) {
        if (!controller.startup()) {
            return LifecycleController.EXIT_FAILURE;
        }
        return controller.run();
    }

    static LifecycleController createController(BotFrameConfig config, ExitHandler exitHandler) {
        return new LifecycleController(config,
                PluginFactoryRegistry.fromServiceLoader(NativeBotFrame.class.getClassLoader()),
                exitHandler);
    }

    /**
     * 关闭钩子模式：触发关闭并在两个阶段的总时限内等待结束
     */
    private static void awaitShutdown(LifecycleController controller, BotFrameConfig config) {
        controller.onTerminationSignal("shutdown-hook");
        long budget = config.pluginShutdownTimeoutMillis() + config.backgroundTasksTimeoutMillis() + 1000L;
        try {
            if (!controller.awaitStopped(budget)) {
                log.warn("BotFrame did not stop within {} ms", budget);
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for BotFrame to stop");
            Thread.currentThread().interrupt();
        }
    }
}
