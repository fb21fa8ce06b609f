package com.kilnlang.ir.graph;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块图：顶层模块列表 + 规范名根。
 *
 * <p>模块列表是可变的，过滤器会直接替换其内容。一个图只属于产生它的请求，不跨请求共享。</p>
 */
public final class ModuleGraph {
    private final List<ModuleNode> modules;
    private final CanonicalNameRoot root;

    public ModuleGraph() {
        this(new ArrayList<>(), new CanonicalNameRoot());
    }

    public ModuleGraph(List<ModuleNode> modules, CanonicalNameRoot root) {
        this.modules = new ArrayList<>(modules);
        this.root = root;
    }

    /** 顶层模块（可变视图） */
    public List<ModuleNode> getModules() {
        return modules;
    }

    public CanonicalNameRoot getRoot() {
        return root;
    }

    public ModuleNode findModule(URI identity) {
        for (ModuleNode module : modules) {
            if (module.getIdentity().equals(identity)) {
                return module;
            }
        }
        return null;
    }

    public List<URI> getModuleIdentities() {
        List<URI> ids = new ArrayList<>(modules.size());
        for (ModuleNode module : modules) {
            ids.add(module.getIdentity());
        }
        return ids;
    }

    /** 为所有顶层模块计算规范名 */
    public void computeCanonicalNames() {
        for (ModuleNode module : modules) {
            module.computeCanonicalNames(root);
        }
    }
}
