package com.botframe.core.lifecycle;

import com.botframe.api.plugin.LongRunning;
import com.botframe.api.plugin.PluginFactory;
import com.botframe.api.plugin.Teardown;
import com.botframe.core.config.BotFrameConfig;
import com.botframe.core.config.EnablementPolicy;
import com.botframe.core.config.KindPolicy;
import com.botframe.core.kernel.PluginFactoryRegistry;
import com.botframe.core.testsupport.JarResourceServiceFactory;
import com.botframe.core.testsupport.PluginTree;
import com.botframe.core.testsupport.TestFactories;
import com.botframe.core.testsupport.TestJars;
import com.botframe.core.testsupport.TestPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LifecycleController 单元测试")
class LifecycleControllerTest {

    @TempDir
    Path projectRoot;

    private PluginTree tree;
    private PluginFactoryRegistry registry;
    private RecordingExitHandler exitHandler;
    private LifecycleController controller;

    @BeforeEach
    void setUp() {
        tree = new PluginTree(projectRoot.resolve("plugins"));
        registry = new PluginFactoryRegistry();
        exitHandler = new RecordingExitHandler();
    }

    @AfterEach
    void tearDown() {
        if (controller != null) {
            controller.shutdown();
        }
    }

    // ==================== 辅助类 ====================

    static class RecordingExitHandler implements ExitHandler {
        final List<Integer> exits = new CopyOnWriteArrayList<>();
        final List<Integer> halts = new CopyOnWriteArrayList<>();

        @Override
        public void exit(int status) {
            exits.add(status);
        }

        @Override
        public void halt(int status) {
            halts.add(status);
        }
    }

    /**
     * 阻塞到被中断的服务
     */
    static class BlockingService implements LongRunning, Teardown {
        final CountDownLatch started = new CountDownLatch(1);
        final AtomicBoolean interrupted = new AtomicBoolean();
        final AtomicBoolean tornDown = new AtomicBoolean();

        @Override
        public void run() throws InterruptedException {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
        }

        @Override
        public void shutdown() {
            tornDown.set(true);
        }
    }

    /**
     * 忽略中断的服务，直到 release
     */
    static class StubbornService implements LongRunning {
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public void run() {
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    // 故意忽略取消请求
                }
            }
        }
    }

    private BotFrameConfig config(double pluginTimeout, double tasksTimeout, String... services) {
        return BotFrameConfig.builder()
                .projectRoot(projectRoot.toString())
                .enablementPolicy(EnablementPolicy.builder()
                        .services(KindPolicy.builder().enabled(List.of(services)).build())
                        .build())
                .pluginShutdownTimeoutSeconds(pluginTimeout)
                .backgroundTasksTimeoutSeconds(tasksTimeout)
                .build();
    }

    private LifecycleController controller(BotFrameConfig config) {
        controller = new LifecycleController(config, registry, exitHandler);
        return controller;
    }

    // ==================== 启动 ====================

    @Nested
    @DisplayName("启动")
    class StartupTests {

        @Test
        @DisplayName("启动后进入 RUNNING 并为带运行入口的服务启动后台任务")
        void startupShouldSpawnTasks() throws Exception {
            BlockingService bot = new BlockingService();
            tree.utility("db").service("bot", "db").service("passive");
            registry.register(TestFactories.plugin("db"))
                    .register(TestFactories.of("bot", deps -> bot))
                    .register(TestFactories.plugin("passive"));

            assertTrue(controller(config(1, 1, "bot", "passive")).startup());

            assertEquals(ControllerState.RUNNING, controller.getState());
            assertTrue(bot.started.await(5, TimeUnit.SECONDS));
            assertEquals(1, controller.getBackgroundTasks().size());
            assertEquals("bot", controller.getBackgroundTasks().get(0).getServiceName());
            assertTrue(controller.getKernel().get("db").isPresent());
            assertSame(controller.getPlanner(), controller.getKernel().getUtility("settings_manager").orElseThrow());
            assertTrue(exitHandler.exits.isEmpty());
        }

        @Test
        @DisplayName("启动失败时关闭并以状态码 1 退出")
        void startupFailureShouldExitWithOne() {
            tree.utility("a", "b").utility("b", "a");

            assertFalse(controller(config(1, 1)).startup());

            assertEquals(List.of(LifecycleController.EXIT_FAILURE), exitHandler.exits);
            assertEquals(ControllerState.STOPPED, controller.getState());
        }

        @Test
        @DisplayName("工厂抛出链接错误时其他服务照常启动")
        void linkageErrorInFactoryShouldNotAbortStartup() throws Exception {
            BlockingService bot = new BlockingService();
            tree.service("broken").service("bot");
            registry.register(TestFactories.of("broken", deps -> {
                        throw new NoClassDefFoundError("com/example/Missing");
                    }))
                    .register(TestFactories.of("bot", deps -> bot));

            assertTrue(controller(config(1, 1, "broken", "bot")).startup());

            assertEquals(ControllerState.RUNNING, controller.getState());
            assertTrue(bot.started.await(5, TimeUnit.SECONDS));
            assertTrue(controller.getKernel().get("broken").isEmpty());
            assertTrue(exitHandler.exits.isEmpty());
        }

        @Test
        @DisplayName("启动中出现 Error 时同样关闭并以状态码 1 退出")
        void errorDuringStartupShouldExitWithOne() {
            tree.service("bot");
            registry = new PluginFactoryRegistry() {
                @Override
                public Optional<PluginFactory<?>> find(String pluginName) {
                    throw new AssertionError("registry unavailable");
                }
            };

            assertFalse(controller(config(1, 1, "bot")).startup());

            assertEquals(List.of(LifecycleController.EXIT_FAILURE), exitHandler.exits);
            assertEquals(ControllerState.STOPPED, controller.getState());
        }

        @Test
        @DisplayName("只能启动一次")
        void secondStartupShouldBeRejected() {
            controller(config(1, 1)).startup();

            assertFalse(controller.startup());
        }

        @Test
        @DisplayName("没有插件时照常启动")
        void emptyTreeShouldStart() {
            assertTrue(controller(config(1, 1)).startup());
            assertTrue(controller.getBackgroundTasks().isEmpty());
        }
    }

    // ==================== 运行与关闭 ====================

    @Nested
    @DisplayName("运行与关闭")
    class RunTests {

        @Test
        @DisplayName("requestShutdown 使 run 返回 0，任务被取消，钩子被调用")
        void requestShutdownShouldStopEverything() throws Exception {
            BlockingService bot = new BlockingService();
            tree.service("bot");
            registry.register(TestFactories.of("bot", deps -> bot));
            controller(config(1, 1, "bot")).startup();
            assertTrue(bot.started.await(5, TimeUnit.SECONDS));

            CompletableFuture<Integer> exitCode = CompletableFuture.supplyAsync(controller::run);
            controller.requestShutdown();

            assertEquals(LifecycleController.EXIT_OK, exitCode.get(5, TimeUnit.SECONDS));
            assertEquals(ControllerState.STOPPED, controller.getState());
            assertTrue(bot.tornDown.get());
            await().atMost(Duration.ofSeconds(2)).until(bot.interrupted::get);
            assertTrue(controller.getBackgroundTasks().get(0).isFinished());
        }

        @Test
        @DisplayName("run 在未启动时返回 1")
        void runWithoutStartupShouldFail() {
            assertEquals(LifecycleController.EXIT_FAILURE, controller(config(1, 1)).run());
        }

        @Test
        @DisplayName("慢销毁钩子在第一阶段超时后被放弃")
        void slowTeardownShouldBeAbandoned() {
            CountDownLatch release = new CountDownLatch(1);
            tree.utility("slow").service("bot", "slow");
            registry.register(TestFactories.of("slow", deps -> (Teardown) () -> release.await(10, TimeUnit.SECONDS)))
                    .register(TestFactories.plugin("bot"));
            controller(config(0.2, 0.2, "bot")).startup();

            long start = System.nanoTime();
            try {
                controller.shutdown();
            } finally {
                release.countDown();
            }
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMillis < 2000, "shutdown took " + elapsedMillis + " ms");
            assertEquals(ControllerState.STOPPED, controller.getState());
        }

        @Test
        @DisplayName("忽略中断的任务在第二阶段超时后不再等待")
        void stubbornTaskShouldNotBlockShutdown() {
            StubbornService stubborn = new StubbornService();
            tree.service("stubborn");
            registry.register(TestFactories.of("stubborn", deps -> stubborn));
            controller(config(0.2, 0.2, "stubborn")).startup();

            long start = System.nanoTime();
            try {
                controller.shutdown();
                long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

                assertTrue(elapsedMillis < 2000, "shutdown took " + elapsedMillis + " ms");
                assertFalse(controller.getBackgroundTasks().get(0).isFinished());
            } finally {
                stubborn.release.countDown();
            }
        }

        @Test
        @DisplayName("插件类加载器在后台任务退出后才关闭")
        void classLoadersShouldOutliveBackgroundTasks() throws Exception {
            List<Object> sink = new CopyOnWriteArrayList<>();
            tree.service(JarResourceServiceFactory.NAME, JarResourceServiceFactory.SINK)
                    .utility(JarResourceServiceFactory.SINK);
            TestJars.write(tree.root().resolve("services").resolve(JarResourceServiceFactory.NAME)
                            .resolve(JarResourceServiceFactory.NAME + ".jar"),
                    new Class<?>[]{JarResourceServiceFactory.class},
                    Map.of(JarResourceServiceFactory.RESOURCE, "only inside the plugin jar"),
                    JarResourceServiceFactory.class.getName());
            registry.register(TestFactories.of(JarResourceServiceFactory.SINK, deps -> sink));
            controller(config(1, 2, JarResourceServiceFactory.NAME)).startup();
            assertEquals(ControllerState.RUNNING, controller.getState());
            await().atMost(Duration.ofSeconds(5)).until(() -> sink.contains(JarResourceServiceFactory.STARTED));

            controller.shutdown();

            assertTrue(controller.getBackgroundTasks().get(0).isFinished());
            assertEquals(2, sink.size());
            String resource = (String) sink.get(1);
            assertNotEquals("null", resource);
            assertTrue(resource.endsWith(JarResourceServiceFactory.RESOURCE), resource);
        }

        @Test
        @DisplayName("重复关闭只执行一次")
        void shutdownShouldBeIdempotent() {
            tree.service("bot");
            TestFactories.CountingFactory<TestPlugin> factory = TestFactories.plugin("bot");
            registry.register(factory);
            controller(config(1, 1, "bot")).startup();
            TestPlugin bot = (TestPlugin) controller.getKernel().get("bot").orElseThrow();

            controller.shutdown();
            controller.shutdown();

            assertEquals(1, bot.getShutdownCalls());
        }
    }

    // ==================== 信号 ====================

    @Nested
    @DisplayName("终止信号")
    class SignalTests {

        @Test
        @DisplayName("第一次信号触发优雅关闭")
        void firstSignalShouldRequestShutdown() throws Exception {
            controller(config(1, 1)).startup();
            CompletableFuture<Integer> exitCode = CompletableFuture.supplyAsync(controller::run);

            controller.onTerminationSignal("SIGTERM");

            assertEquals(LifecycleController.EXIT_OK, exitCode.get(5, TimeUnit.SECONDS));
            assertTrue(controller.awaitStopped(1000));
            assertTrue(exitHandler.halts.isEmpty());
        }

        @Test
        @DisplayName("关闭完成前的第二次信号立即终止进程")
        void secondSignalShouldHalt() {
            controller(config(1, 1)).startup();

            controller.onTerminationSignal("SIGINT");
            controller.onTerminationSignal("SIGINT");

            assertEquals(List.of(LifecycleController.EXIT_FAILURE), exitHandler.halts);
        }

        @Test
        @DisplayName("关闭完成后的信号被忽略")
        void signalAfterStopShouldBeIgnored() {
            controller(config(1, 1)).startup();
            controller.onTerminationSignal("SIGTERM");
            controller.shutdown();

            controller.onTerminationSignal("SIGTERM");

            assertTrue(exitHandler.halts.isEmpty());
        }
    }
}
