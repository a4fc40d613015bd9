package com.craftplane.core.conflict;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.core.version.VersionComparator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 冲突检测器
 * <p>
 * 检查 已安装×候选 以及 候选×候选 的每一对插件，汇总所有规则命中的冲突和建议。
 */
@Slf4j
public class ConflictDetector {

    private final List<ConflictRule> rules;

    public ConflictDetector(List<ConflictRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<ConflictRule> defaultRules(VersionComparator versionComparator) {
        return List.of(
                new DuplicateVersionRule(versionComparator),
                new CommandCollisionRule(),
                new DependencyConstraintRule(versionComparator));
    }

    public ConflictAnalysis analyze(List<PluginPackage> installed, List<PluginPackage> candidates) {
        List<ConflictFinding> findings = new ArrayList<>();

        for (PluginPackage existing : installed) {
            for (PluginPackage candidate : candidates) {
                if (existing.getId().equals(candidate.getId())) {
                    continue;
                }
                evaluate(existing, candidate, findings);
            }
        }

        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                PluginPackage first = candidates.get(i);
                PluginPackage second = candidates.get(j);
                if (first.getId().equals(second.getId())) {
                    continue;
                }
                evaluate(first, second, findings);
            }
        }

        if (findings.isEmpty()) {
            return ConflictAnalysis.none();
        }
        List<PluginConflict> conflicts = findings.stream().map(ConflictFinding::conflict).toList();
        List<ConflictRecommendation> recommendations = findings.stream()
                .map(ConflictFinding::recommendation)
                .toList();
        log.debug("Conflict analysis found {} conflicts", conflicts.size());
        return new ConflictAnalysis(true, conflicts, recommendations);
    }

    private void evaluate(PluginPackage first, PluginPackage second, List<ConflictFinding> findings) {
        for (ConflictRule rule : rules) {
            findings.addAll(rule.detect(first, second));
            if (!rule.isSymmetric()) {
                findings.addAll(rule.detect(second, first));
            }
        }
    }
}
