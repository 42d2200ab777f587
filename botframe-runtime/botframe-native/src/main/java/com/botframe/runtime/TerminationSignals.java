package com.botframe.runtime;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.List;
import java.util.function.Consumer;

/**
 * 安装 SIGINT / SIGTERM 处理器
 * <p>
 * 通过 jdk.unsupported 中的 sun.misc.Signal 反射安装，每次信号都转交给回调；
 * 当前 JVM 不支持时退化为关闭钩子，此时只能处理第一次信号。
 */
@Slf4j
final class TerminationSignals {

    static final List<String> SIGNALS = List.of("INT", "TERM");

    private static final String SIGNAL_CLASS = "sun.misc.Signal";
    private static final String HANDLER_CLASS = "sun.misc.SignalHandler";

    private TerminationSignals() {
    }

    /**
     * @return 是否成功安装了原生信号处理器
     */
    static boolean install(Consumer<String> onSignal, Runnable shutdownHookFallback) {
        try {
            Class<?> signalClass = Class.forName(SIGNAL_CLASS);
            Class<?> handlerClass = Class.forName(HANDLER_CLASS);
            Method handle = signalClass.getMethod("handle", signalClass, handlerClass);
            Method getName = signalClass.getMethod("getName");

            Object handler = Proxy.newProxyInstance(
                    TerminationSignals.class.getClassLoader(),
                    new Class<?>[]{handlerClass},
                    (proxy, method, args) -> {
                        if ("handle".equals(method.getName())) {
                            onSignal.accept("SIG" + getName.invoke(args[0]));
                            return null;
                        }
                        if ("toString".equals(method.getName())) {
                            return "BotFrameSignalHandler";
                        }
                        if ("hashCode".equals(method.getName())) {
                            return System.identityHashCode(proxy);
                        }
                        if ("equals".equals(method.getName())) {
                            return proxy == args[0];
                        }
                        return null;
                    });

            for (String name : SIGNALS) {
                Object signal = signalClass.getConstructor(String.class).newInstance(name);
                handle.invoke(null, signal, handler);
            }
            log.debug("Signal handlers installed for {}", SIGNALS);
            return true;
        } catch (ClassNotFoundException | NoSuchMethodException | IllegalAccessException
                 | InstantiationException | InvocationTargetException e) {
            log.warn("Native signal handling unavailable ({}), falling back to shutdown hook", e.toString());
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHookFallback, "botframe-shutdown-hook"));
            return false;
        }
    }
}
