package com.botframe.core.testsupport;

import com.botframe.api.plugin.PluginKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 在临时目录中搭建插件树
 * <pre>
 * root/utilities/&lt;dir&gt;/config.yaml
 * root/services/&lt;dir&gt;/config.yaml
 * </pre>
 */
public final class PluginTree {

    private final Path root;

    public PluginTree(Path root) {
        this.root = root;
    }

    public PluginTree utility(String name, String... dependencies) {
        return plugin(PluginKind.UTILITY, name, descriptor(name, true, dependencies));
    }

    public PluginTree transientUtility(String name, String... dependencies) {
        return plugin(PluginKind.UTILITY, name, descriptor(name, false, dependencies));
    }

    public PluginTree service(String name, String... dependencies) {
        return plugin(PluginKind.SERVICE, name, descriptor(name, true, dependencies));
    }

    public PluginTree plugin(PluginKind kind, String relativeDir, String yaml) {
        write(root.resolve(kind.getDirectory()).resolve(relativeDir).resolve("config.yaml"), yaml);
        return this;
    }

    public PluginTree file(String relativePath, String content) {
        write(root.resolve(relativePath), content);
        return this;
    }

    public Path root() {
        return root;
    }

    public static String descriptor(String name, boolean singleton, String... dependencies) {
        StringBuilder yaml = new StringBuilder()
                .append("name: ").append(name).append('\n')
                .append("singleton: ").append(singleton).append('\n');
        if (dependencies.length > 0) {
            yaml.append("dependencies:\n");
            for (String dep : dependencies) {
                yaml.append("  - ").append(dep).append('\n');
            }
        }
        return yaml.toString();
    }

    private static void write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
