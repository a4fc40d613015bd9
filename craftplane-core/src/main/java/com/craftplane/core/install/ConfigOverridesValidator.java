package com.craftplane.core.install;

import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.api.exception.ReasonCode;
import com.craftplane.core.config.CraftPlaneConfig;
import lombok.RequiredArgsConstructor;

import java.util.Collection;
import java.util.Map;

/**
 * 配置覆盖项校验
 * <p>
 * 值只允许 JSON 可表达的类型：null、Boolean、Number、String、List、Map(键为字符串)。
 */
@RequiredArgsConstructor
public class ConfigOverridesValidator {

    private final CraftPlaneConfig config;

    public void validate(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return;
        }
        if (overrides.size() > config.getMaxConfigEntries()) {
            throw invalid("configOverrides", String.format("Too many configuration entries: %d (max %d)",
                    overrides.size(), config.getMaxConfigEntries()));
        }
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw invalid("configOverrides", "Configuration key cannot be blank");
            }
            if (key.length() > config.getMaxConfigKeyLength()) {
                throw invalid(key, String.format("Configuration key exceeds %d characters",
                        config.getMaxConfigKeyLength()));
            }
            checkValue(key, entry.getValue());
        }
    }

    private void checkValue(String path, Object value) {
        if (value == null || value instanceof Boolean || value instanceof Number || value instanceof String) {
            return;
        }
        if (value instanceof Collection<?> list) {
            for (Object item : list) {
                checkValue(path + "[]", item);
            }
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> nested : map.entrySet()) {
                if (!(nested.getKey() instanceof String nestedKey)) {
                    throw invalid(path, "Nested configuration keys must be strings");
                }
                checkValue(path + "." + nestedKey, nested.getValue());
            }
            return;
        }
        throw invalid(path, "Unsupported configuration value type: " + value.getClass().getSimpleName());
    }

    private static InvalidArgumentException invalid(String field, String message) {
        return new InvalidArgumentException(ReasonCode.INVALID_CONFIGURATION, field, message);
    }
}
