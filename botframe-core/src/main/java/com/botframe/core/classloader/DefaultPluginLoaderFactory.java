package com.botframe.core.classloader;

import com.botframe.core.spi.PluginLoaderFactory;

import java.net.URL;

public class DefaultPluginLoaderFactory implements PluginLoaderFactory {

    @Override
    public ClassLoader create(String pluginName, URL[] urls, ClassLoader parent) {
        return new PluginClassLoader(pluginName, urls, parent);
    }
}
