package com.craftplane.core.install.stream;

import com.craftplane.api.model.InstallationStatus;

import java.time.Instant;

/**
 * 安装进度消息
 *
 * @param progress 0-100
 * @param error    仅失败时非空
 */
public record InstallUpdate(String installationId, InstallationStatus status, int progress, String message,
                            String error, Instant timestamp) {

    public InstallUpdate {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be within 0-100: " + progress);
        }
    }

    public static InstallUpdate of(String installationId, InstallationStatus status, int progress, String message) {
        return new InstallUpdate(installationId, status, progress, message, null, Instant.now());
    }

    public static InstallUpdate failed(String installationId, String message, String error) {
        return new InstallUpdate(installationId, InstallationStatus.FAILED, 100, message, error, Instant.now());
    }

    public boolean isFinal() {
        return progress == 100;
    }
}
