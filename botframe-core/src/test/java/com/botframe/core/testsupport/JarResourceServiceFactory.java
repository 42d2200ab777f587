package com.botframe.core.testsupport;

import com.botframe.api.plugin.Dependencies;
import com.botframe.api.plugin.LongRunning;
import com.botframe.api.plugin.PluginFactory;

import java.net.URL;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * 只通过插件 jar 注册的服务：运行到被中断，中断后从自己的 jar 读取资源
 * <p>
 * 结果写入宿主提供的 sink 工具（JDK 类型，宿主与插件共享）。
 */
public class JarResourceServiceFactory implements PluginFactory<LongRunning> {

    public static final String NAME = "jar-service";
    public static final String SINK = "resource_sink";
    public static final String RESOURCE = "jar-only.txt";
    public static final String STARTED = "started";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    @SuppressWarnings("unchecked")
    public LongRunning create(Dependencies dependencies) {
        List<Object> sink = dependencies.require(SINK, List.class);
        return () -> {
            sink.add(STARTED);
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                URL resource = getClass().getClassLoader().getResource(RESOURCE);
                sink.add(String.valueOf(resource));
                throw e;
            }
        };
    }
}
