package com.kilnlang.ir.graph;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 模块图中的一个模块节点（编译单元）。
 */
public final class ModuleNode {
    private final URI identity;
    private final List<URI> dependencies;
    private final List<Declaration> declarations;
    private boolean canonicalOwner;

    public ModuleNode(URI identity, List<URI> dependencies, List<Declaration> declarations) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
        this.canonicalOwner = true;
    }

    /** 模块身份（导入 URI） */
    public URI getIdentity() {
        return identity;
    }

    public Reference getReference() {
        return Reference.module(identity);
    }

    public List<URI> getDependencies() {
        return dependencies;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public Declaration findDeclaration(String name) {
        for (Declaration decl : declarations) {
            if (decl.getName().equals(name)) {
                return decl;
            }
        }
        return null;
    }

    /**
     * 该图是否拥有此模块的规范名。
     * 被过滤器剔除、只按身份保留绑定的模块为 false。
     */
    public boolean isCanonicalOwner() {
        return canonicalOwner;
    }

    public void setCanonicalOwner(boolean canonicalOwner) {
        this.canonicalOwner = canonicalOwner;
    }

    /**
     * 把本模块及其全部声明的规范名绑定到 {@code root}。
     */
    public void computeCanonicalNames(CanonicalNameRoot root) {
        root.bind(getReference());
        for (Declaration decl : declarations) {
            root.bind(Reference.member(identity, decl.getName()));
        }
    }

    /** 本模块对外的全部引用：依赖模块 + 声明引用的目标 */
    public Set<Reference> getOutgoingReferences() {
        Set<Reference> refs = new LinkedHashSet<>();
        for (URI dep : dependencies) {
            refs.add(Reference.module(dep));
        }
        for (Declaration decl : declarations) {
            if (decl.getTarget() != null) {
                refs.add(decl.getTarget());
            }
        }
        return refs;
    }

    /** 去掉所有常量后的副本 */
    public ModuleNode outline() {
        List<Declaration> outlines = new ArrayList<>(declarations.size());
        for (Declaration decl : declarations) {
            outlines.add(decl.outline());
        }
        ModuleNode copy = new ModuleNode(identity, dependencies, outlines);
        copy.canonicalOwner = canonicalOwner;
        return copy;
    }

    @Override
    public String toString() {
        return "module " + identity;
    }
}
