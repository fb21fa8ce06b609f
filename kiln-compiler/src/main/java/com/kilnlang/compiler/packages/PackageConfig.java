package com.kilnlang.compiler.packages;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 包元数据：包名 → 包根 URI。
 *
 * <p>文件格式为每行 {@code name:rootUri}，{@code #} 开头为注释。
 * 相对的根 URI 以元数据文件自身的位置为基准解析。</p>
 */
public final class PackageConfig {

    public static final PackageConfig EMPTY = new PackageConfig(Collections.<String, URI>emptyMap());

    private final Map<String, URI> roots;

    private PackageConfig(Map<String, URI> roots) {
        this.roots = roots;
    }

    /**
     * 解析包元数据
     *
     * @param content 文件内容
     * @param base    元数据文件自身的 URI
     * @throws IllegalArgumentException 行格式不合法
     */
    public static PackageConfig parse(byte[] content, URI base) {
        Map<String, URI> roots = new LinkedHashMap<>();
        String[] lines = new String(content, StandardCharsets.UTF_8).split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Invalid package entry at line " + (i + 1) + ": " + line);
            }
            String name = line.substring(0, colon);
            String root = line.substring(colon + 1);
            if (!root.endsWith("/")) {
                root = root + "/";
            }
            roots.put(name, base.resolve(URI.create(root)));
        }
        return new PackageConfig(Collections.unmodifiableMap(roots));
    }

    /**
     * 把 {@code package:name/path} 解析为包根下的物理 URI
     *
     * @return 解析结果；包未声明时返回 null
     */
    public URI resolve(URI packageUri) {
        // 使用转义形式，解码后的 %20 不能再构成 URI
        String ssp = packageUri.getRawSchemeSpecificPart();
        int slash = ssp.indexOf('/');
        if (slash <= 0) {
            return null;
        }
        URI root = roots.get(ssp.substring(0, slash));
        // "./" 前缀防止首段中的 ':' 被当作 scheme
        return root != null ? root.resolve(URI.create("./" + ssp.substring(slash + 1))) : null;
    }

    public Map<String, URI> getRoots() {
        return roots;
    }
}
