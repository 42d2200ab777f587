package com.botframe.core.testsupport;

import com.botframe.api.plugin.Dependencies;
import com.botframe.api.plugin.PluginFactory;

/**
 * 通过 META-INF/services 注册的测试工厂
 */
public class EchoUtilityFactory implements PluginFactory<EchoUtilityFactory.Echo> {

    @Override
    public String name() {
        return "echo_utility";
    }

    @Override
    public Echo create(Dependencies dependencies) {
        return new Echo();
    }

    public static class Echo {
        public String echo(String value) {
            return value;
        }
    }
}
