package com.craftplane.core.conflict;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.core.version.VersionComparator;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一方依赖另一方，但另一方的版本不满足约束
 * <p>
 * 内部检查两个方向，因此按对称规则只调用一次。
 */
@RequiredArgsConstructor
public class DependencyConstraintRule implements ConflictRule {

    private final VersionComparator versionComparator;

    @Override
    public List<ConflictFinding> detect(PluginPackage first, PluginPackage second) {
        List<ConflictFinding> findings = new ArrayList<>(2);
        check(first, second, findings);
        check(second, first, findings);
        return findings;
    }

    private void check(PluginPackage depender, PluginPackage provider, List<ConflictFinding> findings) {
        String constraint = depender.getDependencies().get(provider.getName());
        if (constraint == null || versionComparator.satisfies(provider.getVersion(), constraint)) {
            return;
        }
        PluginConflict conflict = PluginConflict.between(ConflictType.DEPENDENCY, depender, provider,
                String.format("%s requires %s %s", depender.getName(), provider.getName(), constraint),
                ConflictSeverity.MEDIUM);
        ConflictRecommendation recommendation = new ConflictRecommendation(RecommendationType.UPDATE,
                String.format("Update %s to a version satisfying %s", provider.getName(), constraint),
                provider.getId(), "Update " + provider.getName());
        findings.add(new ConflictFinding(conflict, recommendation));
    }
}
