package com.craftplane.core.loader;

import com.craftplane.api.model.PluginCategory;
import com.craftplane.api.model.PluginPackage;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 YAML 读取插件目录
 * <p>
 * location 支持 {@code classpath:} 前缀和普通文件路径。
 * 分类缺省或为空时按 {@code utility} 处理。
 */
@Slf4j
public class PluginCatalogLoader {

    private static final String CLASSPATH_PREFIX = "classpath:";

    public static List<PluginPackage> load(InputStream inputStream) {
        // 默认 TagInspector 拒绝全局标签，目录文件不允许实例化任意类型
        Constructor constructor = new Constructor(CatalogDefinition.class, new LoaderOptions());
        Yaml yaml = new Yaml(constructor);

        CatalogDefinition definition = yaml.load(inputStream);
        if (definition == null || definition.getPlugins() == null) {
            return List.of();
        }

        List<PluginPackage> result = new ArrayList<>();
        for (CatalogDefinition.Entry entry : definition.getPlugins()) {
            PluginPackage plugin = toPackage(entry);
            plugin.validate();
            result.add(plugin);
        }
        return result;
    }

    public static List<PluginPackage> load(String location) {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
            if (classLoader == null) {
                classLoader = PluginCatalogLoader.class.getClassLoader();
            }
            try (InputStream in = classLoader.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IllegalArgumentException("Catalog resource not found: " + location);
                }
                return logLoaded(location, load(in));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read catalog: " + location, e);
            }
        }
        try (InputStream in = Files.newInputStream(Path.of(location))) {
            return logLoaded(location, load(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog: " + location, e);
        }
    }

    private static List<PluginPackage> logLoaded(String location, List<PluginPackage> plugins) {
        log.info("Loaded {} catalog entries from {}", plugins.size(), location);
        return plugins;
    }

    private static PluginPackage toPackage(CatalogDefinition.Entry entry) {
        String id = entry.getId();
        if (id == null || id.isBlank()) {
            id = entry.getName() + "@" + entry.getVersion();
        }
        Instant createdAt = parseInstant(entry.getCreatedAt());
        Instant updatedAt = entry.getUpdatedAt() != null ? parseInstant(entry.getUpdatedAt()) : createdAt;

        PluginPackage.PluginPackageBuilder builder = PluginPackage.builder()
                .id(id)
                .name(entry.getName())
                .version(entry.getVersion())
                .description(entry.getDescription())
                .category(toCategory(entry.getCategory()))
                .approved(entry.isApproved())
                .downloadCount(entry.getDownloadCount())
                .rating(entry.getRating())
                .createdAt(createdAt)
                .updatedAt(updatedAt);
        if (entry.getGameVersions() != null) {
            builder.gameVersions(entry.getGameVersions());
        }
        if (entry.getDependencies() != null) {
            builder.dependencies(entry.getDependencies());
        }
        if (entry.getCommands() != null) {
            builder.commands(entry.getCommands());
        }
        return builder.build();
    }

    private static PluginCategory toCategory(String code) {
        return code == null || code.isBlank() ? PluginCategory.UTILITY : PluginCategory.fromCode(code.trim());
    }

    private static Instant parseInstant(String value) {
        return value == null ? Instant.EPOCH : Instant.parse(value);
    }
}
