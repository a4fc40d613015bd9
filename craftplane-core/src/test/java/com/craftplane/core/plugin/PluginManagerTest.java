package com.craftplane.core.plugin;

import com.craftplane.api.exception.CircularDependencyException;
import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.api.exception.PluginNotFoundException;
import com.craftplane.api.model.InstallationStatus;
import com.craftplane.core.compat.CompatibilityResult;
import com.craftplane.core.config.CraftPlaneConfig;
import com.craftplane.core.conflict.ConflictAnalysis;
import com.craftplane.core.conflict.ConflictType;
import com.craftplane.core.conflict.RecommendationType;
import com.craftplane.core.executor.ThreadPoolInstallationExecutor;
import com.craftplane.core.graph.DependencyEdge;
import com.craftplane.core.graph.DependencyGraph;
import com.craftplane.core.graph.DependencyNode;
import com.craftplane.core.install.InstallRequest;
import com.craftplane.core.install.InstallResult;
import com.craftplane.core.install.UninstallOptions;
import com.craftplane.core.install.stream.InstallSubscription;
import com.craftplane.core.install.stream.InstallUpdate;
import com.craftplane.core.query.PluginFilters;
import com.craftplane.core.query.ServerPluginView;
import com.craftplane.core.repository.InMemoryInstallationRepository;
import com.craftplane.core.repository.InMemoryPluginCatalogRepository;
import com.craftplane.core.repository.InMemoryServerRepository;
import com.craftplane.core.spi.AuditSink;
import com.craftplane.core.spi.ComputeBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.craftplane.core.support.TestPlugins.plugin;
import static com.craftplane.core.support.TestPlugins.server;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PluginManager 集成测试")
public class PluginManagerTest {

    private static final String SERVER_ID = "srv-1";

    @Mock
    private ComputeBackend computeBackend;

    @Mock
    private AuditSink auditSink;

    private InMemoryPluginCatalogRepository catalog;
    private InMemoryInstallationRepository installations;
    private PluginManager manager;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryPluginCatalogRepository();
        installations = new InMemoryInstallationRepository();
        InMemoryServerRepository servers = new InMemoryServerRepository();
        servers.register(server(SERVER_ID, "1.20.1"));

        catalog.register(plugin("PluginA", "1.0.0").dependency("PluginB", "any").build());
        catalog.register(plugin("PluginB", "1.0.0").dependency("PluginC", ">=1.0.0").build());
        catalog.register(plugin("PluginC", "1.0.0").build());
        catalog.register(plugin("PluginX", "1.0.0").command("px").build());
        catalog.register(plugin("PluginX", "2.0.0").command("px").build());

        CraftPlaneConfig config = CraftPlaneConfig.builder()
                .executorCorePoolSize(2)
                .executorMaxPoolSize(4)
                .build();
        manager = new PluginManager(config, catalog, installations, servers, computeBackend, auditSink,
                new ThreadPoolInstallationExecutor(config));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private void awaitStatus(String pluginId, InstallationStatus status) {
        await()
                .atMost(5, TimeUnit.SECONDS)
                .until(() -> installations.findByServerAndPlugin(SERVER_ID, pluginId)
                        .map(i -> i.getStatus() == status)
                        .orElse(false));
    }

    @Nested
    @DisplayName("端到端安装")
    class EndToEndTests {

        @Test
        @DisplayName("自动依赖安装后三个插件都进入 installed")
        void autoDependencyInstallShouldComplete() {
            InstallResult result = manager.install(InstallRequest.builder()
                    .serverId(SERVER_ID).pluginId("plugina-1.0.0").autoDependencies(true).build());

            assertEquals(List.of("pluginc-1.0.0", "pluginb-1.0.0"), result.getDependencies());
            awaitStatus("plugina-1.0.0", InstallationStatus.INSTALLED);
            awaitStatus("pluginb-1.0.0", InstallationStatus.INSTALLED);
            awaitStatus("pluginc-1.0.0", InstallationStatus.INSTALLED);

            List<ServerPluginView> views = manager.listServerPlugins(SERVER_ID, PluginFilters.none());
            assertEquals(3, views.size());
            assertTrue(views.stream().allMatch(ServerPluginView::isEnabled));
        }

        @Test
        @DisplayName("订阅者收到递增进度和最终消息")
        void subscriberShouldReceiveFinalUpdate() throws InterruptedException {
            CountDownLatch gate = new CountDownLatch(1);
            doAnswer(invocation -> {
                gate.await(5, TimeUnit.SECONDS);
                return null;
            }).when(computeBackend).stagePlugin(any(), any());

            InstallResult result = manager.install(InstallRequest.of(SERVER_ID, "pluginc-1.0.0"));

            List<InstallUpdate> received = new ArrayList<>();
            try (InstallSubscription subscription = manager.subscribe(result.getInstallationId())) {
                gate.countDown();
                InstallUpdate update;
                do {
                    update = subscription.poll(Duration.ofSeconds(5));
                    assertNotNull(update);
                    received.add(update);
                } while (!update.isFinal());
            }

            for (int i = 1; i < received.size(); i++) {
                assertTrue(received.get(i).progress() > received.get(i - 1).progress());
            }
            InstallUpdate last = received.get(received.size() - 1);
            assertEquals(InstallationStatus.INSTALLED, last.status());
            assertEquals(100, last.progress());
        }

        @Test
        @DisplayName("卸载后记录被删除")
        void uninstallShouldRemoveRecord() {
            manager.install(InstallRequest.of(SERVER_ID, "pluginc-1.0.0"));
            awaitStatus("pluginc-1.0.0", InstallationStatus.INSTALLED);

            manager.uninstall(SERVER_ID, "pluginc-1.0.0", UninstallOptions.defaults());

            await()
                    .atMost(5, TimeUnit.SECONDS)
                    .until(() -> installations.findByServerAndPlugin(SERVER_ID, "pluginc-1.0.0").isEmpty());
        }
    }

    @Nested
    @DisplayName("分析")
    class AnalysisTests {

        @Test
        @DisplayName("安装顺序为 C、B、A")
        void installOrderShouldPutDependenciesFirst() {
            assertEquals(List.of("pluginc-1.0.0", "pluginb-1.0.0", "plugina-1.0.0"),
                    manager.getInstallOrder(List.of("plugina-1.0.0"), "1.20.1"));
        }

        @Test
        @DisplayName("手工构造的环形图报告循环依赖")
        void cyclicGraphShouldFail() {
            DependencyGraph graph = new DependencyGraph();
            graph.addNode(new DependencyNode("a", "A", "1.0.0", true));
            graph.addNode(new DependencyNode("b", "B", "1.0.0", true));
            graph.addEdge(new DependencyEdge("a", "b", "any", false));
            graph.addEdge(new DependencyEdge("b", "a", "any", false));

            assertThrows(CircularDependencyException.class, () -> manager.getInstallOrder(graph));
            assertThrows(InvalidArgumentException.class, () -> manager.getInstallOrder((DependencyGraph) null));
        }

        @Test
        @DisplayName("两个版本的 PluginX 产生重复冲突")
        void duplicateVersionsShouldConflict() {
            ConflictAnalysis analysis = manager.checkConflicts(SERVER_ID, List.of("pluginx-1.0.0", "pluginx-2.0.0"));

            assertTrue(analysis.hasConflicts());
            assertEquals(1, analysis.conflicts().size());
            assertEquals(ConflictType.DUPLICATE, analysis.conflicts().get(0).type());
            assertEquals(RecommendationType.REMOVE, analysis.recommendations().get(0).type());
            assertEquals("pluginx-1.0.0", analysis.recommendations().get(0).targetPluginId());
        }

        @Test
        @DisplayName("未知候选插件抛出 plugin_not_found")
        void unknownCandidateShouldFail() {
            assertThrows(PluginNotFoundException.class,
                    () -> manager.checkConflicts(SERVER_ID, List.of("ghost")));
        }

        @Test
        @DisplayName("兼容性校验报告缺失依赖")
        void validateCompatibilityShouldReportMissingDependency() {
            CompatibilityResult result = manager.validateCompatibility("plugina-1.0.0", SERVER_ID);

            assertFalse(result.isCompatible());
            assertTrue(result.hasDependencyIssues());
            assertEquals("PluginB", result.getDependencyIssues().get(0).dependencyName());
        }
    }
}
