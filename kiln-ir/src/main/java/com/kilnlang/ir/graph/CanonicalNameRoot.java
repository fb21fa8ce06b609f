package com.kilnlang.ir.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规范名根：引用键 → 规范名 的映射表。
 *
 * <p>只按身份记录绑定，不持有任何 {@link ModuleNode}。插入顺序即序列化顺序。</p>
 */
public final class CanonicalNameRoot {
    private final Map<Reference, CanonicalName> names = new LinkedHashMap<>();

    /**
     * 绑定引用（幂等）
     *
     * @return 该引用的规范名
     */
    public CanonicalName bind(Reference reference) {
        CanonicalName existing = names.get(reference);
        if (existing != null) {
            return existing;
        }
        // 成员名总是挂在所属模块名之下
        if (!reference.isModule()) {
            bind(reference.moduleReference());
        }
        CanonicalName name = new CanonicalName(reference);
        names.put(reference, name);
        return name;
    }

    /** 查找已绑定的规范名，未绑定返回 null */
    public CanonicalName lookup(Reference reference) {
        return names.get(reference);
    }

    public boolean isBound(Reference reference) {
        return names.containsKey(reference);
    }

    public Collection<CanonicalName> getNames() {
        return Collections.unmodifiableCollection(names.values());
    }

    public int size() {
        return names.size();
    }
}
