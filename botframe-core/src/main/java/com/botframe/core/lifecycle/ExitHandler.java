package com.botframe.core.lifecycle;

/**
 * 进程退出方式，测试中替换为记录退出码的实现
 */
public interface ExitHandler {

    /**
     * 正常退出，会执行 JVM 关闭钩子
     */
    void exit(int status);

    /**
     * 立即终止，不执行关闭钩子
     */
    void halt(int status);

    static ExitHandler system() {
        return new ExitHandler() {
            @Override
            public void exit(int status) {
                Runtime.getRuntime().exit(status);
            }

            @Override
            public void halt(int status) {
                Runtime.getRuntime().halt(status);
            }
        };
    }
}
