package com.botframe.core.lifecycle;

import com.botframe.api.plugin.LongRunning;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BackgroundTask 单元测试")
class BackgroundTaskTest {

    @Mock
    private ExecutorService executor;

    @Mock
    private Future<Object> future;

    // 提交给执行器但尚未运行的任务体
    private final AtomicReference<Runnable> submitted = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        doAnswer(inv -> {
            submitted.set(inv.getArgument(0));
            return future;
        }).when(executor).submit(any(Runnable.class));
        when(future.isDone()).thenReturn(false);
        when(future.cancel(true)).thenReturn(true);
    }

    @Test
    @DisplayName("运行前被取消：立即视为结束，之后入口不再执行")
    void cancelBeforeRunShouldSkipEntryPoint() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        BackgroundTask task = BackgroundTask.start("bot", runs::incrementAndGet, executor);

        task.cancel();
        assertTrue(task.isFinished());

        // 执行线程在取消之后才拿到任务体
        submitted.get().run();

        assertEquals(0, runs.get());
        verify(future).cancel(true);
    }

    @Test
    @DisplayName("运行中被取消：入口返回前不视为结束")
    void cancelWhileRunningShouldWaitForEntryPoint() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        LongRunning entryPoint = () -> {
            entered.countDown();
            release.await();
        };
        BackgroundTask task = BackgroundTask.start("bot", entryPoint, executor);
        CompletableFuture<Void> running = CompletableFuture.runAsync(submitted.get());
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        task.cancel();

        assertFalse(task.isFinished());
        assertFalse(task.awaitTermination(50));

        release.countDown();
        running.get(5, TimeUnit.SECONDS);
        assertTrue(task.awaitTermination(1000));
    }
}
