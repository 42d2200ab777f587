package com.botframe.core.exception;

import com.botframe.api.exception.BotFrameException;

/**
 * 依赖闭包计算失败（缺失依赖、依赖被禁用或局部环）
 * 只会让启动计划缩小，不会中止进程
 */
public class DependencyException extends BotFrameException {

    private final String root;

    public DependencyException(String root, String message) {
        super("[" + root + "] " + message);
        this.root = root;
    }

    public String getRoot() {
        return root;
    }
}
