package com.botframe.core.kernel;

import com.botframe.api.plugin.Dependencies;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 已解析依赖的只读视图
 */
final class KernelDependencies implements Dependencies {

    private final Map<String, Object> resolved;

    KernelDependencies(Map<String, Object> resolved) {
        this.resolved = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    @Override
    public Optional<Object> get(String name) {
        return Optional.ofNullable(resolved.get(name));
    }

    @Override
    public boolean contains(String name) {
        return resolved.containsKey(name);
    }

    @Override
    public Set<String> names() {
        return resolved.keySet();
    }

    @Override
    public String toString() {
        return "Dependencies" + resolved.keySet();
    }
}
