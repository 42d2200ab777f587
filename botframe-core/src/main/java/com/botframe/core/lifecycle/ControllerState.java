package com.botframe.core.lifecycle;

/**
 * 控制器状态，只能向前推进
 * <p>
 * CREATED -> STARTING -> RUNNING -> SHUTTING_DOWN -> STOPPED
 */
public enum ControllerState {

    CREATED,
    STARTING,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
