package com.botframe.core.lifecycle;

import com.botframe.api.plugin.LongRunning;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 服务长期运行入口的句柄
 * <p>
 * Future 被取消后立即算作 done，真正的线程退出由 finished 闩锁反映。
 */
@Slf4j
public final class BackgroundTask {

    private final String serviceName;
    private final CountDownLatch finished = new CountDownLatch(1);
    // 运行线程与 cancel 竞争同一个标记，抢到的一方负责释放 finished
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private volatile Future<?> future;

    private BackgroundTask(String serviceName) {
        this.serviceName = serviceName;
    }

    static BackgroundTask start(String serviceName, LongRunning entryPoint, ExecutorService executor) {
        BackgroundTask task = new BackgroundTask(serviceName);
        task.future = executor.submit(() -> task.execute(entryPoint));
        return task;
    }

    private void execute(LongRunning entryPoint) {
        if (!claimed.compareAndSet(false, true)) {
            log.debug("[{}] Service task cancelled before it started", serviceName);
            return;
        }
        try {
            log.debug("[{}] Service task started", serviceName);
            entryPoint.run();
            log.info("[{}] Service task finished", serviceName);
        } catch (InterruptedException e) {
            log.info("[{}] Service task cancelled", serviceName);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("[{}] Service task failed: {}", serviceName, e.getMessage(), e);
        } finally {
            finished.countDown();
        }
    }

    /**
     * 请求取消（中断运行线程）
     */
    public void cancel() {
        if (claimed.compareAndSet(false, true)) {
            // 入口尚未运行，之后也不会再运行
            finished.countDown();
        }
        Future<?> current = future;
        if (current != null && !current.isDone()) {
            current.cancel(true);
            log.debug("[{}] Service task cancellation requested", serviceName);
        }
    }

    /**
     * 等待运行线程真正退出
     *
     * @return 超时前是否已退出
     */
    public boolean awaitTermination(long timeoutMillis) throws InterruptedException {
        return finished.await(Math.max(0L, timeoutMillis), TimeUnit.MILLISECONDS);
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public String getServiceName() {
        return serviceName;
    }

    @Override
    public String toString() {
        return "BackgroundTask{" + serviceName + (isFinished() ? ", finished" : ", running") + "}";
    }
}
