package com.kilnlang.compiler.ast;

/**
 * {@code val name: Type = initializer;}
 */
public final class ValDecl {
    private final String name;
    private final String typeName;
    private final Expression initializer;
    private final SourceLocation location;

    public ValDecl(String name, String typeName, Expression initializer, SourceLocation location) {
        this.name = name;
        this.typeName = typeName;
        this.initializer = initializer;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
