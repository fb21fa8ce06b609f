package com.kilnlang.compiler.ast;

import com.kilnlang.ir.graph.ValueType;

/**
 * 字面量：Int / String / Bool
 */
public final class Literal extends Expression {
    private final Object value;
    private final ValueType type;

    public Literal(Object value, ValueType type, SourceLocation location) {
        super(location);
        this.value = value;
        this.type = type;
    }

    public Object getValue() {
        return value;
    }

    public ValueType getType() {
        return type;
    }
}
