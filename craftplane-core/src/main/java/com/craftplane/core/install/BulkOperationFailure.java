package com.craftplane.core.install;

public record BulkOperationFailure(String pluginId, String reasonCode, String message) {
}
