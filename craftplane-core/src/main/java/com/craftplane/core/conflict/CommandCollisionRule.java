package com.craftplane.core.conflict;

import com.craftplane.api.model.PluginPackage;

import java.util.List;
import java.util.Set;

/**
 * 不同插件注册了同一个命令
 */
public class CommandCollisionRule implements ConflictRule {

    @Override
    public List<ConflictFinding> detect(PluginPackage first, PluginPackage second) {
        if (first.getName().equals(second.getName())) {
            return List.of();
        }
        Set<String> shared = first.sharedCommands(second);
        if (shared.isEmpty()) {
            return List.of();
        }
        PluginConflict conflict = PluginConflict.between(ConflictType.RESOURCE, first, second,
                "Both plugins register commands " + shared, ConflictSeverity.MEDIUM);
        ConflictRecommendation recommendation = new ConflictRecommendation(RecommendationType.CONFIGURE,
                "Configure command aliases to avoid the collision", second.getId(),
                "Remap commands " + shared + " of " + second.getName());
        return List.of(new ConflictFinding(conflict, recommendation));
    }
}
