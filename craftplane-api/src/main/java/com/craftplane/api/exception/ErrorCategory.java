package com.craftplane.api.exception;

/**
 * 错误分类
 * <p>
 * 同步失败按分类直接返回调用方；EXECUTION 只出现在安装记录和进度流中。
 */
public enum ErrorCategory {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    INCOMPATIBILITY,
    GRAPH,
    EXECUTION
}
