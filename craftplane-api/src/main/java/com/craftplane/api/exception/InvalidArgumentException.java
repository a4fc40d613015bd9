package com.craftplane.api.exception;

import lombok.Getter;

/**
 * 参数校验失败
 */
@Getter
public class InvalidArgumentException extends CraftPlaneException {

    private final String field;

    public InvalidArgumentException(String field, String message) {
        this(ReasonCode.INVALID_REQUEST, field, message);
    }

    public InvalidArgumentException(ReasonCode reason, String field, String message) {
        super(reason, message);
        this.field = field;
    }
}
