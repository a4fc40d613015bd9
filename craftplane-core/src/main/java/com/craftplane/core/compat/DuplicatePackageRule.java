package com.craftplane.core.compat;

import com.craftplane.api.model.PluginPackage;

import java.util.ArrayList;
import java.util.List;

/**
 * 同名同版本的插件已经以另一条目录记录安装
 */
public class DuplicatePackageRule implements ResourceConflictRule {

    @Override
    public List<ResourceConflict> check(PluginPackage candidate, List<PluginPackage> present) {
        List<ResourceConflict> conflicts = new ArrayList<>();
        for (PluginPackage other : present) {
            if (other.getName().equals(candidate.getName()) && other.getVersion().equals(candidate.getVersion())) {
                conflicts.add(new ResourceConflict(ResourceConflictType.DUPLICATE, other.getId(),
                        String.format("%s is already installed as %s", candidate.getUniqueKey(), other.getId())));
            }
        }
        return conflicts;
    }
}
