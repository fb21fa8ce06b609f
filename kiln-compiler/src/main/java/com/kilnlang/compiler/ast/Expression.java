package com.kilnlang.compiler.ast;

/**
 * 初始化表达式：字面量或名字引用
 */
public abstract class Expression {
    private final SourceLocation location;

    protected Expression(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
