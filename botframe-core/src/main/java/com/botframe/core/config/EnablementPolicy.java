package com.botframe.core.config;

import com.botframe.api.plugin.PluginKind;
import lombok.Builder;
import lombok.Value;

/**
 * 插件启用策略文档
 * 服务默认关闭，工具默认开启
 */
@Value
@Builder
public class EnablementPolicy {

    @Builder.Default
    KindPolicy services = KindPolicy.denyAll();

    @Builder.Default
    KindPolicy utilities = KindPolicy.allowAll();

    public static EnablementPolicy defaults() {
        return EnablementPolicy.builder().build();
    }

    public KindPolicy forKind(PluginKind kind) {
        return kind == PluginKind.SERVICE ? services : utilities;
    }

    public boolean isEnabled(PluginKind kind, String name) {
        return forKind(kind).isEnabled(name);
    }
}
