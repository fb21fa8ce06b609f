package com.kilnlang.ir.graph;

/**
 * 声明的值类型
 */
public enum ValueType {
    INT("Int"),
    STRING("String"),
    BOOL("Bool");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    /** 按源码中的类型名查找，未知类型返回 null */
    public static ValueType fromName(String name) {
        for (ValueType type : values()) {
            if (type.displayName.equals(name)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
