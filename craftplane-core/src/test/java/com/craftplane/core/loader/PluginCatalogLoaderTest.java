package com.craftplane.core.loader;

import com.craftplane.api.model.PluginCategory;
import com.craftplane.api.model.PluginPackage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginCatalogLoader 单元测试")
public class PluginCatalogLoaderTest {

    @Test
    @DisplayName("从 classpath 读取目录")
    void shouldLoadFromClasspath() {
        List<PluginPackage> plugins = PluginCatalogLoader.load("classpath:catalog/test-catalog.yml");

        assertEquals(3, plugins.size());

        PluginPackage essentials = plugins.get(0);
        assertEquals("essentials-2.20.0", essentials.getId());
        assertEquals(PluginCategory.ADMIN, essentials.getCategory());
        assertEquals(Map.of("Vault", ">=1.7.0"), essentials.getDependencies());
        assertEquals(Set.of("home", "spawn", "warp"), essentials.getCommands());
        assertEquals(150_000L, essentials.getDownloadCount());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), essentials.getUpdatedAt());
        assertTrue(essentials.isCompatibleWith("1.19.4"));
    }

    @Test
    @DisplayName("缺省字段取默认值")
    void missingFieldsShouldDefault() {
        List<PluginPackage> plugins = PluginCatalogLoader.load("classpath:/catalog/test-catalog.yml");

        PluginPackage vault = plugins.get(1);
        assertEquals("Vault@1.7.3", vault.getId());
        assertTrue(vault.isApproved());
        assertEquals(vault.getCreatedAt(), vault.getUpdatedAt());

        PluginPackage clearLag = plugins.get(2);
        assertFalse(clearLag.isApproved());
        assertEquals(Instant.EPOCH, clearLag.getCreatedAt());
        assertTrue(clearLag.getCategory().requiresRestart());
    }

    @Test
    @DisplayName("从文件路径读取目录")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("catalog.yml");
        Files.writeString(file, """
                plugins:
                  - name: Chat
                    version: "1.0.0"
                    gameVersions: ["1.20.1"]
                """);

        List<PluginPackage> plugins = PluginCatalogLoader.load(file.toString());

        assertEquals(1, plugins.size());
        assertEquals(PluginCategory.UTILITY, plugins.get(0).getCategory());
    }

    @Test
    @DisplayName("空文档返回空列表")
    void emptyDocumentShouldYieldEmptyList() {
        assertTrue(PluginCatalogLoader.load(new ByteArrayInputStream(new byte[0])).isEmpty());
    }

    @Test
    @DisplayName("缺少名称的条目被拒绝")
    void invalidEntryShouldFail() {
        String yaml = """
                plugins:
                  - version: "1.0.0"
                """;

        assertThrows(IllegalArgumentException.class,
                () -> PluginCatalogLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    @DisplayName("分类显式为空时按 utility 处理")
    void nullCategoryShouldDefaultToUtility() {
        String yaml = """
                plugins:
                  - name: Chat
                    version: "1.0.0"
                    category: ~
                    gameVersions: ["1.20.1"]
                  - name: Board
                    version: "1.0.0"
                    category: " "
                    gameVersions: ["1.20.1"]
                  - name: Terra
                    version: "1.0.0"
                    category: World
                    gameVersions: ["1.20.1"]
                """;

        List<PluginPackage> plugins = PluginCatalogLoader.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(PluginCategory.UTILITY, plugins.get(0).getCategory());
        assertEquals(PluginCategory.UTILITY, plugins.get(1).getCategory());
        assertEquals(PluginCategory.WORLD, plugins.get(2).getCategory());
    }

    @Test
    @DisplayName("全局类型标签被拒绝")
    void globalTagShouldBeRejected() {
        String yaml = """
                plugins:
                  - name: !!java.lang.StringBuilder "Chat"
                    version: "1.0.0"
                    gameVersions: ["1.20.1"]
                """;

        assertThrows(YAMLException.class,
                () -> PluginCatalogLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    @DisplayName("资源不存在时报错")
    void missingResourceShouldFail() {
        assertThrows(IllegalArgumentException.class, () -> PluginCatalogLoader.load("classpath:missing.yml"));
        assertThrows(UncheckedIOException.class, () -> PluginCatalogLoader.load("/no/such/catalog.yml"));
    }
}
