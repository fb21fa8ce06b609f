package com.kilnlang.compiler.ast;

/**
 * 对可见声明的名字引用
 */
public final class NameRef extends Expression {
    private final String name;

    public NameRef(String name, SourceLocation location) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
