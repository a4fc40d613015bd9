package com.craftplane.core.install;

import java.time.Duration;
import java.util.List;

/**
 * @param removed 已开始卸载的插件 id
 */
public record BulkUninstallResult(int total, List<String> removed, List<BulkOperationFailure> failed,
                                  Duration estimatedDuration) {

    public BulkUninstallResult {
        removed = List.copyOf(removed);
        failed = List.copyOf(failed);
    }

    public int getSuccessCount() {
        return removed.size();
    }

    public int getFailureCount() {
        return failed.size();
    }
}
