package com.craftplane.api.exception;

import lombok.Getter;

/**
 * CraftPlane 基础异常
 * 所有同步失败都携带一个稳定的 {@link ReasonCode}
 *
 * @author CraftPlane
 */
@Getter
public class CraftPlaneException extends RuntimeException {

    private final ReasonCode reason;

    public CraftPlaneException(ReasonCode reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CraftPlaneException(ReasonCode reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * 机器可读原因码，如 "already_installed"
     */
    public String getReasonCode() {
        return reason.code();
    }

    public ErrorCategory getCategory() {
        return reason.category();
    }
}
