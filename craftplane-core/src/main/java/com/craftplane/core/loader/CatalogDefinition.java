package com.craftplane.core.loader;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 目录种子文件结构 (catalog.yml)
 */
@Data
public class CatalogDefinition {

    private List<Entry> plugins = new ArrayList<>();

    @Data
    public static class Entry {
        private String id;
        private String name;
        private String version;
        private String description;
        // gameplay / admin / economy ...
        private String category = "utility";
        private List<String> gameVersions = new ArrayList<>();
        private Map<String, String> dependencies = new LinkedHashMap<>();
        private List<String> commands = new ArrayList<>();
        private boolean approved = true;
        private long downloadCount;
        private double rating;
        // ISO-8601
        private String createdAt;
        private String updatedAt;
    }
}
