package com.craftplane.core.conflict;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.core.version.LexicographicVersionComparator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.craftplane.core.support.TestPlugins.plugin;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConflictDetector 单元测试")
public class ConflictDetectorTest {

    private ConflictDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ConflictDetector(ConflictDetector.defaultRules(new LexicographicVersionComparator()));
    }

    @Nested
    @DisplayName("重复版本")
    class DuplicateTests {

        @Test
        @DisplayName("已装 PluginX v1，候选 v2：高严重度重复冲突，建议移除旧版本")
        void installedAndCandidateVersionsShouldConflict() {
            PluginPackage v1 = plugin("PluginX", "1.0.0").build();
            PluginPackage v2 = plugin("PluginX", "2.0.0").build();

            ConflictAnalysis analysis = detector.analyze(List.of(v1), List.of(v2));

            assertTrue(analysis.hasConflicts());
            assertEquals(1, analysis.conflicts().size());
            PluginConflict conflict = analysis.conflicts().get(0);
            assertEquals(ConflictType.DUPLICATE, conflict.type());
            assertEquals(ConflictSeverity.HIGH, conflict.severity());
            assertEquals("PluginX v1.0.0", conflict.firstLabel());

            ConflictRecommendation recommendation = analysis.recommendations().get(0);
            assertEquals(RecommendationType.REMOVE, recommendation.type());
            assertEquals("pluginx-1.0.0", recommendation.targetPluginId());
        }

        @Test
        @DisplayName("候选之间的重复版本同样检测")
        void candidatePairShouldBeChecked() {
            ConflictAnalysis analysis = detector.analyze(List.of(),
                    List.of(plugin("PluginX", "2.0.0").build(), plugin("PluginX", "1.0.0").build()));

            assertEquals(1, analysis.conflicts().size());
            assertEquals("pluginx-1.0.0", analysis.recommendations().get(0).targetPluginId());
        }

        @Test
        @DisplayName("同一插件同时是已装和候选时不算冲突")
        void samePluginShouldNotConflictWithItself() {
            PluginPackage v1 = plugin("PluginX", "1.0.0").build();

            assertFalse(detector.analyze(List.of(v1), List.of(v1)).hasConflicts());
        }
    }

    @Nested
    @DisplayName("资源与依赖冲突")
    class ResourceAndDependencyTests {

        @Test
        @DisplayName("共享命令：中等严重度，建议调整配置")
        void sharedCommandShouldConflict() {
            PluginPackage homes = plugin("Homes", "1.0.0").command("home").build();
            PluginPackage essentials = plugin("Essentials", "2.0.0").command("home").command("warp").build();

            ConflictAnalysis analysis = detector.analyze(List.of(homes), List.of(essentials));

            PluginConflict conflict = analysis.conflicts().get(0);
            assertEquals(ConflictType.RESOURCE, conflict.type());
            assertEquals(ConflictSeverity.MEDIUM, conflict.severity());
            assertEquals(RecommendationType.CONFIGURE, analysis.recommendations().get(0).type());
        }

        @Test
        @DisplayName("候选依赖的已装版本不满足约束")
        void unsatisfiedConstraintShouldConflict() {
            PluginPackage vault = plugin("Vault", "1.5.0").build();
            PluginPackage shop = plugin("Shop", "1.0.0").dependency("Vault", ">=1.7.0").build();

            ConflictAnalysis analysis = detector.analyze(List.of(vault), List.of(shop));

            assertEquals(1, analysis.conflicts().size());
            PluginConflict conflict = analysis.conflicts().get(0);
            assertEquals(ConflictType.DEPENDENCY, conflict.type());
            assertEquals("shop-1.0.0", conflict.firstPluginId());
            ConflictRecommendation recommendation = analysis.recommendations().get(0);
            assertEquals(RecommendationType.UPDATE, recommendation.type());
            assertEquals("vault-1.5.0", recommendation.targetPluginId());
        }

        @Test
        @DisplayName("满足约束时没有冲突")
        void satisfiedConstraintShouldNotConflict() {
            PluginPackage vault = plugin("Vault", "1.7.3").build();
            PluginPackage shop = plugin("Shop", "1.0.0").dependency("Vault", ">=1.7.0").build();

            assertFalse(detector.analyze(List.of(vault), List.of(shop)).hasConflicts());
        }
    }

    @Nested
    @DisplayName("规则调度")
    class RuleDispatchTests {

        @Test
        @DisplayName("对称规则每个候选对只检查一次")
        void symmetricRuleShouldRunOncePerPair() {
            AtomicInteger calls = new AtomicInteger();
            ConflictDetector counting = new ConflictDetector(List.of((first, second) -> {
                calls.incrementAndGet();
                return List.of();
            }));

            counting.analyze(List.of(), List.of(
                    plugin("A", "1").build(), plugin("B", "1").build(), plugin("C", "1").build()));

            assertEquals(3, calls.get());
        }

        @Test
        @DisplayName("非对称规则两个方向都检查")
        void asymmetricRuleShouldRunBothDirections() {
            AtomicInteger calls = new AtomicInteger();
            ConflictRule rule = new ConflictRule() {
                @Override
                public List<ConflictFinding> detect(PluginPackage first, PluginPackage second) {
                    calls.incrementAndGet();
                    return List.of();
                }

                @Override
                public boolean isSymmetric() {
                    return false;
                }
            };

            new ConflictDetector(List.of(rule)).analyze(List.of(plugin("I", "1").build()),
                    List.of(plugin("A", "1").build(), plugin("B", "1").build()));

            // 已装×候选 2 对 + 候选对 1 对，各两个方向
            assertEquals(6, calls.get());
        }
    }

    @Test
    @DisplayName("无冲突时返回空分析")
    void noConflictShouldReturnEmptyAnalysis() {
        ConflictAnalysis analysis = detector.analyze(List.of(plugin("A", "1.0.0").build()),
                List.of(plugin("B", "1.0.0").build()));

        assertFalse(analysis.hasConflicts());
        assertTrue(analysis.conflicts().isEmpty());
        assertTrue(analysis.recommendations().isEmpty());
    }
}
