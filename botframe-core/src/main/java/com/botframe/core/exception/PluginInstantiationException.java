package com.botframe.core.exception;

import com.botframe.api.exception.BotFrameException;

/**
 * 插件工厂在创建实例时抛出异常
 */
public class PluginInstantiationException extends BotFrameException {

    private final String pluginName;

    public PluginInstantiationException(String pluginName, Throwable cause) {
        super("Failed to create plugin instance: " + pluginName, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
