package com.botframe.core.exception;

import com.botframe.api.exception.BotFrameException;

/**
 * 找不到或无法加载插件实现
 */
public class PluginLoadException extends BotFrameException {

    public PluginLoadException(String message) {
        super(message);
    }

    public PluginLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
