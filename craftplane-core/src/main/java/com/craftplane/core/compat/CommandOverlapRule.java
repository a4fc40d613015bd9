package com.craftplane.core.compat;

import com.craftplane.api.model.PluginPackage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 不同名插件声明了相同的命令
 */
public class CommandOverlapRule implements ResourceConflictRule {

    @Override
    public List<ResourceConflict> check(PluginPackage candidate, List<PluginPackage> present) {
        List<ResourceConflict> conflicts = new ArrayList<>();
        if (candidate.getCommands().isEmpty()) {
            return conflicts;
        }
        for (PluginPackage other : present) {
            if (other.getName().equals(candidate.getName())) {
                continue;
            }
            Set<String> shared = candidate.sharedCommands(other);
            if (!shared.isEmpty()) {
                conflicts.add(new ResourceConflict(ResourceConflictType.COMMAND, other.getId(),
                        String.format("Commands %s are already registered by %s", shared, other.getName())));
            }
        }
        return conflicts;
    }
}
