package com.craftplane.core.compat;

/**
 * 单个直接依赖的问题
 *
 * @param installedVersion 服务器上现有版本，MISSING 时为 null
 */
public record DependencyIssue(String dependencyName, String requiredVersion, String installedVersion,
                              DependencyIssueType type, String message) {

    public static DependencyIssue missing(String name, String constraint) {
        return new DependencyIssue(name, constraint, null, DependencyIssueType.MISSING,
                String.format("Required dependency %s is not installed", name));
    }

    public static DependencyIssue versionMismatch(String name, String constraint, String installedVersion) {
        return new DependencyIssue(name, constraint, installedVersion, DependencyIssueType.VERSION_MISMATCH,
                String.format("Dependency %s version %s does not satisfy %s", name, installedVersion, constraint));
    }
}
