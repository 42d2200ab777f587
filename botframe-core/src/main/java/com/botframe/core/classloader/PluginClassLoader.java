package com.botframe.core.classloader;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * 插件类加载器
 * 特性：
 * 1. Child-First (优先加载插件自带的类)
 * 2. 强制委派白名单 (插件契约与日志门面必须走父加载器)
 * 3. 资源加载 Child-First (插件读取的是自己的 META-INF/services)
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    // 必须强制走父加载器的包（契约包 + JDK）
    private static final List<String> FORCE_PARENT_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.botframe.api.", // 插件契约必须共享，否则 PluginFactory 类型不一致
            "org.slf4j.",        // 注入的 Logger 来自宿主
            "ch.qos.logback.",
            "org.yaml.snakeyaml."
    );

    private final String pluginName;

    public PluginClassLoader(String pluginName, URL[] urls, ClassLoader parent) {
        super("plugin-" + pluginName, urls, parent);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            // 1. 检查缓存
            Class<?> c = findLoadedClass(name);
            if (c != null) return c;

            // 2. 白名单强制委派给父加载器
            if (shouldDelegateToParent(name)) {
                return super.loadClass(name, resolve);
            }

            // 3. Child-First: 优先自己加载
            try {
                c = findClass(name);
            } catch (ClassNotFoundException e) {
                log.trace("[{}] {} not found in plugin, delegating to parent", pluginName, name);
            }

            // 4. 兜底: 自己没有，再找父亲
            if (c == null) {
                c = super.loadClass(name, resolve);
            }

            if (resolve) resolveClass(c);
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        URL url = findResource(name);
        if (url != null) return url;
        return super.getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        // 组合资源：自己的在前 + 父加载器的
        List<URL> urls = new ArrayList<>(Collections.list(findResources(name)));
        if (getParent() != null) {
            urls.addAll(Collections.list(getParent().getResources(name)));
        }
        return Collections.enumeration(urls);
    }

    private boolean shouldDelegateToParent(String name) {
        for (String pkg : FORCE_PARENT_PACKAGES) {
            if (name.startsWith(pkg)) return true;
        }
        return false;
    }
}
