package com.craftplane.core.compat;

import com.craftplane.api.exception.ReasonCode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 兼容性校验结果
 * <p>
 * reason/reasonCode 取第一个阻断项；compatible 为 true 时两者均为 null。
 */
@Getter
@Builder
@ToString
public class CompatibilityResult {

    private final boolean compatible;
    private final String reason;
    private final ReasonCode reasonCode;
    private final boolean gameVersionCompatible;

    @Singular
    private final List<DependencyIssue> dependencyIssues;

    @Singular
    private final List<ResourceConflict> resourceConflicts;

    public boolean hasDependencyIssues() {
        return !dependencyIssues.isEmpty();
    }

    public boolean hasResourceConflicts() {
        return !resourceConflicts.isEmpty();
    }
}
