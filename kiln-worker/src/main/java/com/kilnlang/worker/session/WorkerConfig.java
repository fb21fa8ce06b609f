package com.kilnlang.worker.session;

import com.kilnlang.compiler.service.CompilerService;

/**
 * 进程级配置，来自系统属性。
 *
 * <ul>
 *   <li>{@code kiln.sessionCacheSize}：持久模式缓存的会话数，默认 4，0 表示不缓存</li>
 * </ul>
 */
public final class WorkerConfig {

    public static final String SESSION_CACHE_SIZE = "kiln.sessionCacheSize";
    public static final int DEFAULT_SESSION_CACHE_SIZE = 4;

    private WorkerConfig() {
    }

    public static int sessionCacheSize() {
        return Integer.getInteger(SESSION_CACHE_SIZE, DEFAULT_SESSION_CACHE_SIZE);
    }

    /**
     * 单次模式总是新建会话；持久模式按配置决定是否缓存
     */
    public static SessionProvider sessionProvider(CompilerService service, boolean persistent) {
        int size = sessionCacheSize();
        if (!persistent || size <= 0) {
            return new FreshSessionProvider(service);
        }
        return new CachedSessionProvider(service, size);
    }
}
