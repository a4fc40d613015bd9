package com.craftplane.core.query;

public enum SortOrder {
    ASC,
    DESC
}
