package com.craftplane.core.conflict;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.core.version.VersionComparator;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 同一插件的多个版本
 */
@RequiredArgsConstructor
public class DuplicateVersionRule implements ConflictRule {

    private final VersionComparator versionComparator;

    @Override
    public List<ConflictFinding> detect(PluginPackage first, PluginPackage second) {
        if (!first.getName().equals(second.getName()) || first.getVersion().equals(second.getVersion())) {
            return List.of();
        }
        PluginPackage older = versionComparator.compare(first.getVersion(), second.getVersion()) <= 0 ? first : second;
        PluginConflict conflict = PluginConflict.between(ConflictType.DUPLICATE, first, second,
                "Multiple versions of the same plugin", ConflictSeverity.HIGH);
        ConflictRecommendation recommendation = new ConflictRecommendation(RecommendationType.REMOVE,
                "Remove older version of the plugin", older.getId(),
                "Remove " + older.getName() + " v" + older.getVersion());
        return List.of(new ConflictFinding(conflict, recommendation));
    }
}
