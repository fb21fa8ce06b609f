package com.kilnlang.ir.graph;

/**
 * 规范名：其他产物序列化后引用该模块/声明所用的稳定外部标识。
 */
public final class CanonicalName {
    private final Reference reference;
    private final String name;

    CanonicalName(Reference reference) {
        this.reference = reference;
        this.name = reference.toString();
    }

    public Reference getReference() {
        return reference;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
