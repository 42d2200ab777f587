package com.botframe.core.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * 单个插件种类的启用策略
 * 优先级：disabled 列表 > enabled 列表 > defaultEnabled
 */
@Value
@Builder
public class KindPolicy {

    @Singular("disabledPlugin")
    Set<String> disabled;

    @Singular("enabledPlugin")
    Set<String> enabled;

    boolean defaultEnabled;

    public boolean isEnabled(String name) {
        if (disabled.contains(name)) {
            return false;
        }
        if (enabled.contains(name)) {
            return true;
        }
        return defaultEnabled;
    }

    public static KindPolicy allowAll() {
        return KindPolicy.builder().defaultEnabled(true).build();
    }

    public static KindPolicy denyAll() {
        return KindPolicy.builder().defaultEnabled(false).build();
    }
}
