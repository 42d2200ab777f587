package com.botframe.api.plugin;

/**
 * 服务的长期运行入口
 * <p>
 * 运行在独立的后台线程中。取消通过线程中断传递，
 * 实现应响应 {@link InterruptedException} 或定期检查中断标记后尽快返回。
 *
 * @author BotFrame
 */
public interface LongRunning {

    void run() throws Exception;
}
