package com.kilnlang.worker.filter;

import com.kilnlang.ir.graph.CanonicalNameRoot;
import com.kilnlang.ir.graph.ModuleGraph;
import com.kilnlang.ir.graph.ModuleNode;
import com.kilnlang.ir.graph.Reference;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 摘要过滤：只保留请求的源模块。
 *
 * <p>被剔除的模块先把规范名绑定到根上，并放弃所有权，这样保留模块对它们的引用
 * 在序列化时仍能按身份解析。过滤后检查每个保留模块的全部引用都已绑定。
 * 对同一个图重复过滤结果不变。</p>
 */
public final class GraphFilter {
    private static final Logger LOG = Logger.getLogger(GraphFilter.class.getName());

    private GraphFilter() {
    }

    /**
     * @param keep 要保留的模块身份；可以为空
     * @return 被剔除的模块，按原顺序
     * @throws FilterInvariantException 保留模块引用了无法绑定的目标
     */
    public static List<ModuleNode> filter(ModuleGraph graph, Collection<URI> keep) throws FilterInvariantException {
        Set<URI> keepSet = new HashSet<>(keep);
        List<ModuleNode> kept = new ArrayList<>();
        List<ModuleNode> dropped = new ArrayList<>();
        for (ModuleNode module : graph.getModules()) {
            (keepSet.contains(module.getIdentity()) ? kept : dropped).add(module);
        }

        CanonicalNameRoot root = graph.getRoot();
        for (ModuleNode module : dropped) {
            module.computeCanonicalNames(root);
            module.setCanonicalOwner(false);
        }
        graph.getModules().clear();
        graph.getModules().addAll(kept);
        graph.computeCanonicalNames();

        for (ModuleNode module : kept) {
            for (Reference ref : module.getOutgoingReferences()) {
                if (!root.isBound(ref)) {
                    throw new FilterInvariantException(module.getIdentity(), ref);
                }
            }
        }
        if (!dropped.isEmpty()) {
            LOG.fine("过滤掉 " + dropped.size() + " 个非源模块，保留 " + kept.size() + " 个");
        }
        return dropped;
    }
}
