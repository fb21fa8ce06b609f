package com.kilnlang.worker.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kilnlang.compiler.fs.FileSystem;
import com.kilnlang.compiler.service.CompilerService;
import com.kilnlang.compiler.service.CompilerState;
import com.kilnlang.worker.options.WorkerOptions;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * 持久模式下的会话缓存（Caffeine）。
 *
 * <p>按输入位置缓存上一次的 {@link CompilerState}。输入内容是否变化由编译器
 * 根据摘要判断：未变化时复用已解码的依赖，变化时重新加载并替换缓存项。</p>
 */
public class CachedSessionProvider implements SessionProvider {
    private static final Logger LOG = Logger.getLogger(CachedSessionProvider.class.getName());

    private final CompilerService service;
    private final Cache<List<Object>, CompilerState> states;

    /**
     * @param maximumSize 最大缓存条目数
     */
    public CachedSessionProvider(CompilerService service, long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.service = service;
        this.states = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public CompilationSession open(WorkerOptions options, FileSystem fileSystem) throws IOException {
        List<Object> key = Arrays.<Object>asList(options.getPlatformSummary(), options.getPackageMetadata(),
                options.getInputSummaries(), options.getInputLinked());
        CompilerState previous = states.getIfPresent(key);
        CompilerState state = service.initializeCompiler(previous, options.getPlatformSummary(),
                options.getPackageMetadata(), options.getInputSummaries(), options.getInputLinked(), fileSystem);
        if (previous != null && previous.getInputDigest().equals(state.getInputDigest())) {
            LOG.fine("复用编译会话: " + options.getPlatformSummary());
        }
        states.put(key, state);
        return new CompilationSession(service, state);
    }

    /** 当前缓存条目数（估计值） */
    public long size() {
        return states.estimatedSize();
    }
}
