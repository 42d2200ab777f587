package com.botframe.core.exception;

import com.botframe.api.exception.BotFrameException;

/**
 * 描述文件或配置文件无法读取、格式错误
 */
public class ConfigurationException extends BotFrameException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
