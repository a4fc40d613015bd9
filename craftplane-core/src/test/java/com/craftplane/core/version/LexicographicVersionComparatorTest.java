package com.craftplane.core.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LexicographicVersionComparator 单元测试")
public class LexicographicVersionComparatorTest {

    private final LexicographicVersionComparator comparator = new LexicographicVersionComparator();

    @ParameterizedTest
    @ValueSource(strings = {"any", "*", "", "  ", "ANY", "latest"})
    @DisplayName("通配约束匹配任意版本")
    void wildcardShouldMatchEverything(String constraint) {
        assertTrue(comparator.satisfies("0.0.1", constraint));
    }

    @Test
    @DisplayName("去掉运算符后按字典序比较")
    void operatorShouldBeStripped() {
        assertTrue(comparator.satisfies("1.7.3", ">=1.7.0"));
        assertTrue(comparator.satisfies("1.7.0", "^1.7.0"));
        assertFalse(comparator.satisfies("1.6.9", "~1.7.0"));
        assertTrue(comparator.satisfies("2.0.0", "1.7.0"));
    }

    @Test
    @DisplayName("null 约束视为通配")
    void nullConstraintShouldMatch() {
        assertTrue(comparator.satisfies("1.0.0", null));
    }

    @Test
    @DisplayName("主版本号变化判定")
    void majorChangeShouldCompareLeadingComponent() {
        assertTrue(comparator.isMajorChange("1.9.0", "2.0.0"));
        assertFalse(comparator.isMajorChange("1.0.0", "1.5.2"));
        assertTrue(comparator.isMajorChange("9.0", "10.0"));
        assertFalse(comparator.isMajorChange("", "1.0"));
    }
}
