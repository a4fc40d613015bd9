package com.craftplane.core.graph;

import com.craftplane.api.exception.PluginNotFoundException;
import com.craftplane.core.repository.InMemoryPluginCatalogRepository;
import com.craftplane.core.version.LexicographicVersionComparator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.craftplane.core.support.TestPlugins.plugin;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DependencyGraphBuilder 单元测试")
public class DependencyGraphBuilderTest {

    private InMemoryPluginCatalogRepository catalog;
    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryPluginCatalogRepository();
        builder = new DependencyGraphBuilder(catalog, new LexicographicVersionComparator());
    }

    @Nested
    @DisplayName("传递依赖解析")
    class TransitiveTests {

        @Test
        @DisplayName("A->B->C 应包含三个节点和两条边")
        void chainShouldBeResolved() {
            catalog.register(plugin("PluginA", "1.0.0").dependency("PluginB", "any").build());
            catalog.register(plugin("PluginB", "1.0.0").dependency("PluginC", ">=1.0.0").build());
            catalog.register(plugin("PluginC", "1.0.0").build());

            DependencyGraph graph = builder.resolve(List.of("plugina-1.0.0"), "1.20.1");

            assertEquals(3, graph.size());
            assertEquals(List.of("pluginb-1.0.0"), graph.dependenciesOf("plugina-1.0.0"));
            assertEquals(List.of("pluginc-1.0.0"), graph.dependenciesOf("pluginb-1.0.0"));
            assertEquals(List.of("C", "B", "A"), new InstallOrderPlanner().plan(graph).stream()
                    .map(id -> graph.getNode(id).name().substring(6))
                    .toList());
        }

        @Test
        @DisplayName("共享依赖只出现一次")
        void sharedDependencyShouldBeVisitedOnce() {
            catalog.register(plugin("Left", "1.0.0").dependency("Core", "any").build());
            catalog.register(plugin("Right", "1.0.0").dependency("Core", "any").build());
            catalog.register(plugin("Core", "1.0.0").build());

            DependencyGraph graph = builder.resolve(List.of("left-1.0.0", "right-1.0.0"), "1.20.1");

            assertEquals(3, graph.size());
            assertEquals(2, graph.dependentsOf("core-1.0.0").size());
        }

        @Test
        @DisplayName("循环依赖不会无限递归")
        void cycleShouldNotRecurseForever() {
            catalog.register(plugin("Ping", "1.0.0").dependency("Pong", "any").build());
            catalog.register(plugin("Pong", "1.0.0").dependency("Ping", "any").build());

            DependencyGraph graph = builder.resolve(List.of("ping-1.0.0"), "1.20.1");

            assertEquals(2, graph.size());
            assertEquals(2, graph.getEdges().size());
        }
    }

    @Nested
    @DisplayName("版本选择")
    class CandidateSelectionTests {

        @Test
        @DisplayName("优先选择支持目标游戏版本的依赖")
        void shouldPreferGameVersionSupport() {
            catalog.register(plugin("App", "1.0.0").dependency("Lib", "any").build());
            catalog.register(plugin("Lib", "1.0.0").build());
            catalog.register(plugin("Lib", "2.0.0").clearGameVersions().gameVersion("1.21").build());

            DependencyGraph graph = builder.resolve(List.of("app-1.0.0"), "1.20.1");

            assertTrue(graph.containsNode("lib-1.0.0"));
            assertFalse(graph.containsNode("lib-2.0.0"));
        }

        @Test
        @DisplayName("同等条件下取满足约束的最高版本")
        void shouldPickHighestSatisfyingVersion() {
            catalog.register(plugin("App", "1.0.0").dependency("Lib", ">=1.5.0").build());
            catalog.register(plugin("Lib", "1.0.0").build());
            catalog.register(plugin("Lib", "1.6.0").build());
            catalog.register(plugin("Lib", "1.9.0").build());

            DependencyGraph graph = builder.resolve(List.of("app-1.0.0"), "1.20.1");

            assertEquals(List.of("lib-1.9.0"), graph.dependenciesOf("app-1.0.0"));
        }

        @Test
        @DisplayName("名称只做精确匹配")
        void shouldMatchNameExactly() {
            catalog.register(plugin("App", "1.0.0").dependency("Lib", "any").build());
            catalog.register(plugin("LibExtras", "1.0.0").build());

            DependencyGraph graph = builder.resolve(List.of("app-1.0.0"), "1.20.1");

            assertEquals(1, graph.size());
        }
    }

    @Test
    @DisplayName("目录中没有的依赖被跳过")
    void unresolvableDependencyShouldBeSkipped() {
        catalog.register(plugin("App", "1.0.0").dependency("Missing", "any").build());

        DependencyGraph graph = builder.resolve(List.of("app-1.0.0"), "1.20.1");

        assertEquals(1, graph.size());
        assertTrue(graph.getEdges().isEmpty());
    }

    @Test
    @DisplayName("请求的插件不存在时抛出 plugin_not_found")
    void unknownRequestedPluginShouldFail() {
        PluginNotFoundException ex = assertThrows(PluginNotFoundException.class,
                () -> builder.resolve(List.of("nope"), "1.20.1"));
        assertEquals("plugin_not_found", ex.getReasonCode());
    }
}
