package com.craftplane.core.spi;

import com.craftplane.core.audit.AuditEvent;

/**
 * 审计接收端，调用方不等待结果
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditEvent event);
}
