package com.botframe.api.plugin;

/**
 * 可选的销毁钩子
 * 内核关闭时调用，用于停止插件内部的后台任务、释放连接等
 *
 * @author BotFrame
 */
public interface Teardown {

    void shutdown() throws Exception;
}
