package com.craftplane.core.graph;

import com.craftplane.api.exception.CircularDependencyException;
import com.craftplane.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InstallOrderPlanner 单元测试")
public class InstallOrderPlannerTest {

    private InstallOrderPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new InstallOrderPlanner();
    }

    // ==================== 辅助方法 ====================

    private static DependencyGraph graph(List<String> nodes, String... edges) {
        DependencyGraph graph = new DependencyGraph();
        for (String node : nodes) {
            graph.addNode(new DependencyNode(node, node, "1.0.0", true));
        }
        for (String edge : edges) {
            String[] parts = edge.split("->");
            graph.addEdge(new DependencyEdge(parts[0], parts[1], "any", false));
        }
        return graph;
    }

    private static void assertDependenciesFirst(DependencyGraph graph, List<String> order) {
        for (DependencyEdge edge : graph.getEdges()) {
            assertTrue(order.indexOf(edge.to()) < order.indexOf(edge.from()),
                    edge.to() + " should come before " + edge.from() + " in " + order);
        }
    }

    @Nested
    @DisplayName("拓扑排序")
    class OrderingTests {

        @Test
        @DisplayName("A->B->C 应得到 [C, B, A]")
        void chainShouldBeReversed() {
            DependencyGraph graph = graph(List.of("A", "B", "C"), "A->B", "B->C");

            assertEquals(List.of("C", "B", "A"), planner.plan(graph));
        }

        @Test
        @DisplayName("菱形依赖中每个节点都在其依赖之后")
        void diamondShouldRespectAllEdges() {
            DependencyGraph graph = graph(List.of("app", "left", "right", "core", "util"),
                    "app->left", "app->right", "left->core", "right->core", "right->util", "core->util");

            List<String> order = planner.plan(graph);

            assertEquals(5, order.size());
            assertDependenciesFirst(graph, order);
            assertEquals("util", order.get(0));
            assertEquals("app", order.get(4));
        }

        @Test
        @DisplayName("无依赖的节点按插入顺序输出")
        void independentNodesKeepInsertionOrder() {
            DependencyGraph graph = graph(List.of("x", "y", "z"));

            assertEquals(List.of("x", "y", "z"), planner.plan(graph));
        }

        @Test
        @DisplayName("同一张图多次规划结果一致")
        void planShouldBeDeterministic() {
            DependencyGraph graph = graph(List.of("a", "b", "c", "d"), "a->c", "b->c", "d->a");

            List<String> first = planner.plan(graph);
            for (int i = 0; i < 10; i++) {
                assertEquals(first, planner.plan(graph));
            }
        }

        @Test
        @DisplayName("空图返回空列表")
        void emptyGraphShouldYieldEmptyOrder() {
            assertTrue(planner.plan(new DependencyGraph()).isEmpty());
        }
    }

    @Nested
    @DisplayName("环检测")
    class CycleTests {

        @Test
        @DisplayName("A<->B 应抛出循环依赖异常")
        void twoNodeCycleShouldFail() {
            DependencyGraph graph = graph(List.of("A", "B"), "A->B", "B->A");

            CircularDependencyException ex = assertThrows(CircularDependencyException.class,
                    () -> planner.plan(graph));
            assertEquals("circular_dependency", ex.getReasonCode());
            assertEquals(Set.of("A", "B"), ex.getUnresolved());
        }

        @Test
        @DisplayName("环外节点不计入未解析集合")
        void unresolvedShouldOnlyContainCycleAndDependents() {
            DependencyGraph graph = graph(List.of("top", "x", "y", "leaf"),
                    "top->x", "x->y", "y->x", "x->leaf");

            CircularDependencyException ex = assertThrows(CircularDependencyException.class,
                    () -> planner.plan(graph));
            assertEquals(Set.of("top", "x", "y"), ex.getUnresolved());
        }

        @Test
        @DisplayName("自环也是环")
        void selfLoopShouldFail() {
            DependencyGraph graph = graph(List.of("solo"), "solo->solo");

            assertThrows(CircularDependencyException.class, () -> planner.plan(graph));
        }
    }

    @Test
    @DisplayName("边引用未知节点属于校验错误")
    void edgeToUnknownNodeShouldFail() {
        DependencyGraph graph = graph(List.of("A"), "A->ghost");

        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class, () -> planner.plan(graph));
        assertEquals("invalid_request", ex.getReasonCode());
    }
}
