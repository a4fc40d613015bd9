package com.craftplane.core.install;

import java.time.Duration;
import java.util.List;

/**
 * @param estimatedDuration 成功项预计耗时之和
 */
public record BulkInstallResult(int total, List<InstallResult> successful, List<BulkOperationFailure> failed,
                                Duration estimatedDuration) {

    public BulkInstallResult {
        successful = List.copyOf(successful);
        failed = List.copyOf(failed);
    }

    public int getSuccessCount() {
        return successful.size();
    }

    public int getFailureCount() {
        return failed.size();
    }
}
