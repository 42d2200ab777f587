package com.botframe.core.classloader;

import com.botframe.api.plugin.PluginFactory;
import com.botframe.core.testsupport.JarOnlyFactory;
import com.botframe.core.testsupport.TestJars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginClassLoader 单元测试")
class PluginClassLoaderTest {

    @TempDir
    Path tempDir;

    private PluginClassLoader loaderFor(Path jar) throws Exception {
        return new PluginClassLoader("test", new URL[]{jar.toUri().toURL()}, getClass().getClassLoader());
    }

    @Nested
    @DisplayName("类加载隔离")
    class IsolationTests {

        @Test
        @DisplayName("插件自带的类优先于宿主中的同名类")
        void pluginClassShouldWin() throws Exception {
            Path jar = TestJars.write(tempDir.resolve("plugin.jar"), new Class<?>[]{JarOnlyFactory.class});

            try (PluginClassLoader loader = loaderFor(jar)) {
                Class<?> type = loader.loadClass(JarOnlyFactory.class.getName());

                assertSame(loader, type.getClassLoader());
                assertNotSame(JarOnlyFactory.class, type);
            }
        }

        @Test
        @DisplayName("插件契约始终来自父加载器")
        void contractShouldComeFromParent() throws Exception {
            Path jar = TestJars.write(tempDir.resolve("plugin.jar"), new Class<?>[]{JarOnlyFactory.class});

            try (PluginClassLoader loader = loaderFor(jar)) {
                assertSame(PluginFactory.class, loader.loadClass(PluginFactory.class.getName()));
                assertTrue(PluginFactory.class.isAssignableFrom(loader.loadClass(JarOnlyFactory.class.getName())));
            }
        }

        @Test
        @DisplayName("插件中没有的类交给父加载器")
        void missingClassShouldDelegate() throws Exception {
            try (PluginClassLoader loader = new PluginClassLoader("empty", new URL[]{}, getClass().getClassLoader())) {
                assertSame(JarOnlyFactory.class, loader.loadClass(JarOnlyFactory.class.getName()));
                assertThrows(ClassNotFoundException.class, () -> loader.loadClass("com.example.NonExistentClass"));
            }
        }
    }

    @Nested
    @DisplayName("资源加载")
    class ResourceTests {

        @Test
        @DisplayName("getResources 中插件自己的资源排在前面")
        void ownResourcesShouldComeFirst() throws Exception {
            Path jar = TestJars.write(tempDir.resolve("plugin.jar"), new Class<?>[]{}, JarOnlyFactory.class.getName());

            try (PluginClassLoader loader = loaderFor(jar)) {
                List<URL> urls = Collections.list(loader.getResources(TestJars.SERVICES_ENTRY));

                assertTrue(urls.size() >= 2, "plugin and host registration files expected");
                assertTrue(urls.get(0).toString().contains("plugin.jar"));
                assertTrue(loader.getResource(TestJars.SERVICES_ENTRY).toString().contains("plugin.jar"));
            }
        }

        @Test
        @DisplayName("加载器名称包含插件名")
        void nameShouldContainPluginName() throws Exception {
            try (PluginClassLoader loader = new PluginClassLoader("weather", new URL[]{}, getClass().getClassLoader())) {
                assertEquals("plugin-weather", loader.getName());
                assertEquals("weather", loader.getPluginName());
            }
        }
    }
}
