package com.kilnlang.compiler.service;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * 导入 URI 解析
 */
final class ImportUris {

    private ImportUris() {
    }

    /**
     * 以导入方模块为基准解析导入目标。
     * 绝对 URI 原样返回；{@code package:} 这类不透明 URI 按其路径部分解析。
     */
    static URI resolve(URI base, String spec) throws URISyntaxException {
        URI target = new URI(spec);
        if (target.isAbsolute()) {
            return target;
        }
        if (base.isOpaque()) {
            URI path = new URI(null, null, "/" + base.getSchemeSpecificPart(), null).resolve(target);
            return new URI(base.getScheme() + ":" + path.getRawPath().substring(1));
        }
        URI resolved = base.resolve(target);
        // URI.resolve 会把空 authority 的 "scheme:///p" 写成 "scheme:/p"，这里保持原写法
        if (resolved.getRawAuthority() == null && base.toString().startsWith(base.getScheme() + ":///")) {
            return new URI(resolved.getScheme() + "://" + resolved.getRawPath());
        }
        return resolved;
    }
}
