package com.craftplane.core.version;

import java.util.Set;

/**
 * 简化的版本比较：纯字符串字典序
 * <p>
 * 约束去掉前导运算符（>=, ^, ~ 等）后按 {@code version >= 基准} 判断；
 * "1.10" 与 "1.9" 这类多位数比较结果不符合语义化版本，属已知限制。
 */
public class LexicographicVersionComparator implements VersionComparator {

    private static final Set<String> WILDCARDS = Set.of("", "*", "any", "latest");

    @Override
    public int compare(String left, String right) {
        return left.compareTo(right);
    }

    @Override
    public boolean satisfies(String version, String constraint) {
        if (constraint == null || WILDCARDS.contains(constraint.trim().toLowerCase())) {
            return true;
        }
        if (version == null) {
            return false;
        }
        String baseline = stripOperator(constraint);
        return baseline.isEmpty() || version.compareTo(baseline) >= 0;
    }

    @Override
    public boolean isMajorChange(String from, String to) {
        if (from == null || to == null || from.isEmpty() || to.isEmpty()) {
            return false;
        }
        return !leadingComponent(from).equals(leadingComponent(to));
    }

    static String stripOperator(String constraint) {
        int i = 0;
        String trimmed = constraint.trim();
        while (i < trimmed.length() && "<>=~^v ".indexOf(trimmed.charAt(i)) >= 0) {
            i++;
        }
        return trimmed.substring(i);
    }

    private static String leadingComponent(String version) {
        String stripped = stripOperator(version);
        int dot = stripped.indexOf('.');
        return dot < 0 ? stripped : stripped.substring(0, dot);
    }
}
