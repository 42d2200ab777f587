package com.botframe.core.spi;

import java.net.URL;

/**
 * 插件类加载器工厂 SPI
 */
public interface PluginLoaderFactory {

    /**
     * @param pluginName 插件名
     * @param urls       插件实现所在的 jar 或目录
     * @param parent     父加载器，契约包必须从它加载
     */
    ClassLoader create(String pluginName, URL[] urls, ClassLoader parent);
}
