package com.botframe.api.exception;

/**
 * BotFrame 基础异常
 *
 * @author BotFrame
 */
public class BotFrameException extends RuntimeException {

    public BotFrameException(String message) {
        super(message);
    }

    public BotFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
