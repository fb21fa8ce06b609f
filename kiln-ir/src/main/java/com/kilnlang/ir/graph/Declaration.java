package com.kilnlang.ir.graph;

import java.util.Objects;

/**
 * 模块中的顶层声明。
 *
 * <p>初始化表达式要么是常量（{@link #getConstant()}），要么是对另一个声明的引用
 * （{@link #getTarget()}）。摘要输出不包含常量。</p>
 */
public final class Declaration {
    private final String name;
    private final ValueType type;
    private final Reference target;
    private final Object constant;

    public Declaration(String name, ValueType type, Reference target, Object constant) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.target = target;
        this.constant = constant;
    }

    public String getName() {
        return name;
    }

    public ValueType getType() {
        return type;
    }

    /** 被引用的声明，常量初始化时为 null */
    public Reference getTarget() {
        return target;
    }

    /** Integer / String / Boolean，或 null */
    public Object getConstant() {
        return constant;
    }

    /** 去掉常量后的外形（outline） */
    public Declaration outline() {
        return constant == null ? this : new Declaration(name, type, target, null);
    }

    @Override
    public String toString() {
        return "val " + name + ": " + type;
    }
}
