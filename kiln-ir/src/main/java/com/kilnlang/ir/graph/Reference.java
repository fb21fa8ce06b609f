package com.kilnlang.ir.graph;

import java.net.URI;
import java.util.Objects;

/**
 * 按身份寻址的引用键
 *
 * <p>指向一个模块（{@code member == null}）或模块中的一个声明。
 * 图中所有跨模块引用都以此键表示，而不是持有节点对象本身，
 * 因此从模块列表中移除节点不会产生悬空指针。</p>
 */
public final class Reference {
    private final URI module;
    private final String member;

    private Reference(URI module, String member) {
        this.module = Objects.requireNonNull(module, "module");
        this.member = member;
    }

    public static Reference module(URI module) {
        return new Reference(module, null);
    }

    public static Reference member(URI module, String member) {
        return new Reference(module, Objects.requireNonNull(member, "member"));
    }

    public URI getModule() {
        return module;
    }

    /** 声明名；模块引用返回 null */
    public String getMember() {
        return member;
    }

    public boolean isModule() {
        return member == null;
    }

    public Reference moduleReference() {
        return isModule() ? this : module(module);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference other = (Reference) o;
        return module.equals(other.module) && Objects.equals(member, other.member);
    }

    @Override
    public int hashCode() {
        return 31 * module.hashCode() + (member != null ? member.hashCode() : 0);
    }

    @Override
    public String toString() {
        return member == null ? module.toString() : module + "::" + member;
    }
}
