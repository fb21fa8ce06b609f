package com.kilnlang.worker.options;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个编译请求的选项（picocli）。
 *
 * <p>每个请求创建新实例，不在请求之间共享。</p>
 */
@Command(name = "kiln-summary-worker",
         description = "编译 Kiln 模块并输出摘要（IR 文件）",
         sortOptions = false)
public class WorkerOptions {

    public static final String DEFAULT_MULTI_ROOT_SCHEME = "org-kiln-multi-root";

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "显示帮助")
    boolean help;

    @Option(names = "--summary-only", description = "只输出外形，不含常量（默认）")
    boolean summaryOnlyFlag;

    @Option(names = "--no-summary-only", description = "输出完整模块")
    boolean noSummaryOnly;

    @Option(names = "--exclude-non-sources", description = "输出中只保留 --source 指定的模块")
    boolean excludeNonSources;

    @Option(names = "--platform-summary", paramLabel = "<uri>", description = "平台摘要（必需）")
    URI platformSummary;

    @Option(names = "--input-summary", paramLabel = "<uri>", description = "依赖摘要，可重复")
    List<URI> inputSummaries = new ArrayList<>();

    @Option(names = "--input-linked", paramLabel = "<uri>", description = "已链接的依赖，可重复")
    List<URI> inputLinked = new ArrayList<>();

    @Option(names = "--multi-root", paramLabel = "<uri>", description = "多根文件系统的根，可重复（默认当前目录）")
    List<URI> multiRoots = new ArrayList<>();

    @Option(names = "--multi-root-scheme", paramLabel = "<scheme>",
            description = "多根文件系统的 URI scheme（默认 ${DEFAULT-VALUE}）")
    String multiRootScheme = DEFAULT_MULTI_ROOT_SCHEME;

    @Option(names = "--package-metadata", paramLabel = "<uri>", description = "包元数据文件")
    URI packageMetadata;

    @Option(names = "--source", paramLabel = "<uri>", description = "源模块，可重复（至少一个）")
    List<URI> sources = new ArrayList<>();

    @Option(names = "--output", paramLabel = "<path>", description = "输出文件（必需）")
    String output;

    /**
     * 把相对 URI 以 {@code base}（工作目录）为基准解析，并补上默认的多根
     */
    void resolveAgainst(URI base) {
        platformSummary = resolve(base, platformSummary);
        packageMetadata = resolve(base, packageMetadata);
        inputSummaries = resolveAll(base, inputSummaries);
        inputLinked = resolveAll(base, inputLinked);
        multiRoots = resolveAll(base, multiRoots);
        sources = resolveAll(base, sources);
        if (multiRoots.isEmpty()) {
            multiRoots.add(base);
        }
    }

    private static URI resolve(URI base, URI uri) {
        if (uri == null || uri.isAbsolute()) {
            return uri;
        }
        return base.resolve(uri);
    }

    private static List<URI> resolveAll(URI base, List<URI> uris) {
        List<URI> result = new ArrayList<>(uris.size());
        for (URI uri : uris) {
            result.add(resolve(base, uri));
        }
        return result;
    }

    public boolean isHelp() {
        return help;
    }

    /** 默认 true；{@code --no-summary-only} 关闭 */
    public boolean isSummaryOnly() {
        return !noSummaryOnly;
    }

    public boolean isExcludeNonSources() {
        return excludeNonSources;
    }

    public URI getPlatformSummary() {
        return platformSummary;
    }

    public List<URI> getInputSummaries() {
        return Collections.unmodifiableList(inputSummaries);
    }

    public List<URI> getInputLinked() {
        return Collections.unmodifiableList(inputLinked);
    }

    public List<URI> getMultiRoots() {
        return Collections.unmodifiableList(multiRoots);
    }

    public String getMultiRootScheme() {
        return multiRootScheme;
    }

    public URI getPackageMetadata() {
        return packageMetadata;
    }

    public List<URI> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public String getOutput() {
        return output;
    }
}
