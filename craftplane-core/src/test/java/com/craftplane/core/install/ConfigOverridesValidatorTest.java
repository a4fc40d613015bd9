package com.craftplane.core.install;

import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.core.config.CraftPlaneConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigOverridesValidator 单元测试")
public class ConfigOverridesValidatorTest {

    private final ConfigOverridesValidator validator = new ConfigOverridesValidator(
            CraftPlaneConfig.builder().maxConfigEntries(3).maxConfigKeyLength(10).build());

    @Test
    @DisplayName("JSON 可表达的值全部接受")
    void jsonCompatibleValuesShouldPass() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("enabled", true);
        overrides.put("limits", Map.of("max", 10, "ratio", 0.5, "tags", List.of("a", "b")));
        overrides.put("motd", null);

        assertDoesNotThrow(() -> validator.validate(overrides));
        assertDoesNotThrow(() -> validator.validate(null));
        assertDoesNotThrow(() -> validator.validate(Map.of()));
    }

    @Test
    @DisplayName("条目过多被拒绝")
    void tooManyEntriesShouldFail() {
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> validator.validate(Map.of("a", 1, "b", 2, "c", 3, "d", 4)));

        assertEquals("invalid_configuration", ex.getReasonCode());
    }

    @Test
    @DisplayName("空白或超长的键被拒绝")
    void invalidKeysShouldFail() {
        assertThrows(InvalidArgumentException.class, () -> validator.validate(Map.of(" ", 1)));
        assertThrows(InvalidArgumentException.class, () -> validator.validate(Map.of("veryLongKeyName", 1)));
    }

    @Test
    @DisplayName("嵌套中的非法值同样被拒绝")
    void nestedUnsupportedValueShouldFail() {
        Map<Object, Object> nested = new HashMap<>();
        nested.put(42, "value");

        assertThrows(InvalidArgumentException.class,
                () -> validator.validate(Map.of("list", List.of(1, new StringBuilder("x")))));
        assertThrows(InvalidArgumentException.class,
                () -> validator.validate(Map.of("map", nested)));
    }
}
