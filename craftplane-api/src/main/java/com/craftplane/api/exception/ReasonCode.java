package com.craftplane.api.exception;

/**
 * 稳定的机器可读原因码
 * <p>
 * 客户端依赖 {@link #code()} 做分支判断，已发布的值不可修改。
 */
public enum ReasonCode {

    INVALID_REQUEST("invalid_request", ErrorCategory.VALIDATION),
    INVALID_CONFIGURATION("invalid_configuration", ErrorCategory.VALIDATION),

    PLUGIN_NOT_FOUND("plugin_not_found", ErrorCategory.NOT_FOUND),
    SERVER_NOT_FOUND("server_not_found", ErrorCategory.NOT_FOUND),
    INSTALLATION_NOT_FOUND("installation_not_found", ErrorCategory.NOT_FOUND),
    VERSION_NOT_FOUND("version_not_found", ErrorCategory.NOT_FOUND),

    ALREADY_INSTALLED("already_installed", ErrorCategory.CONFLICT),
    INSTALL_IN_PROGRESS("install_in_progress", ErrorCategory.CONFLICT),
    NOT_INSTALLED("not_installed", ErrorCategory.CONFLICT),
    DEPENDENCY_BLOCKED("dependency_blocked", ErrorCategory.CONFLICT),
    DEPENDENCY_INSTALL_FAILED("dependency_install_failed", ErrorCategory.CONFLICT),

    INCOMPATIBLE("incompatible", ErrorCategory.INCOMPATIBILITY),
    VERSION_MISMATCH("version_mismatch", ErrorCategory.INCOMPATIBILITY),
    UNAPPROVED("unapproved", ErrorCategory.INCOMPATIBILITY),
    DEPENDENCY_MISSING("dependency_missing", ErrorCategory.INCOMPATIBILITY),
    RESOURCE_CONFLICT("resource_conflict", ErrorCategory.INCOMPATIBILITY),

    CIRCULAR_DEPENDENCY("circular_dependency", ErrorCategory.GRAPH),

    EXECUTION_FAILED("execution_failed", ErrorCategory.EXECUTION);

    private final String code;
    private final ErrorCategory category;

    ReasonCode(String code, ErrorCategory category) {
        this.code = code;
        this.category = category;
    }

    public String code() {
        return code;
    }

    public ErrorCategory category() {
        return category;
    }

    @Override
    public String toString() {
        return code;
    }
}
